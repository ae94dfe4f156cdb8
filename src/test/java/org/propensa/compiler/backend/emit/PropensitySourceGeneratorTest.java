package org.propensa.compiler.backend.emit;

import org.propensa.compiler.CompilationException;
import org.propensa.compiler.CompilationResult;
import org.propensa.compiler.ReactionCompiler;
import org.propensa.compiler.api.ReactionModel;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class PropensitySourceGeneratorTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-01-02T03:04:05Z"), ZoneOffset.UTC);

    private static final ReactionModel BIRTH_DEATH = ReactionModel.builder()
            .species("X")
            .rate("k", 1).rate("mu", 1e-3)
            .reaction("@ > k*vol > X")
            .reaction("X > mu*X > @")
            .build();

    private static String generate(ReactionModel model, GeneratorOptions options) throws CompilationException {
        return new ReactionCompiler(options, CLOCK).compile(model).source();
    }

    @Test
    void birthDeathModel_fullSource() throws CompilationException {
        String source = generate(BIRTH_DEATH, GeneratorOptions.defaults());

        assertThat(source).isEqualTo("""
                /* [Remove/modify this line not to overwrite this file] */
                /* Generated by propensa 2026-01-02 03:04 */

                /* Reactions:
                     @ > k*vol > X
                     X > mu*X > @
                */

                #include "propensities.h"
                #include "report.h"

                enum Species {
                  X
                };

                const int NR = 2; /* number of reactions */

                /* rate constants */
                const double k = 1.0;
                const double mu = 0.001;

                /* forward declaration */
                double rFun1(const int *xstate,double time,double vol,
                             const double *ldata,const double *gdata,int sd);
                double rFun2(const int *xstate,double time,double vol,
                             const double *ldata,const double *gdata,int sd);

                /* static propensity vector */
                static PropensityFun ptr[] = {rFun1,rFun2};

                /* propensity definitions */
                double rFun1(const int *xstate,double time,double vol,
                             const double *ldata,const double *gdata,int sd)
                {
                  return k*vol;
                }

                double rFun2(const int *xstate,double time,double vol,
                             const double *ldata,const double *gdata,int sd)
                {
                  return mu*xstate[X];
                }

                /* solver interface */
                PropensityFun *ALLOC_propensities(size_t Mreactions)
                {
                  if (Mreactions > NR) PERROR("Wrong number of reactions.");
                  return ptr;
                }

                void FREE_propensities(PropensityFun *ptr)
                { /* do nothing since a static array was used */ }
                """);
    }

    @Test
    void speciesEnumKeepsInputOrder() throws CompilationException {
        String source = generate(ReactionModel.builder()
                .species("Z", "A", "M")
                .reaction("Z > 1 > A")
                .build(), GeneratorOptions.defaults());

        assertThat(source).contains("enum Species {\n  Z,\n  A,\n  M\n};\n");
    }

    @Test
    void rateValuesArePrintedLosslessly() throws CompilationException {
        String source = generate(ReactionModel.builder()
                .species("X")
                .rate("a", 0.1 + 0.2).rate("b", 1e-4).rate("c", 2.5e7).rate("d", -3)
                .build(), GeneratorOptions.defaults());

        assertThat(source)
                .contains("const double a = 0.30000000000000004;")
                .contains("const double b = 1.0E-4;")
                .contains("const double c = 2.5E7;")
                .contains("const double d = -3.0;");
        assertThat(Double.parseDouble(PropensitySourceGenerator.formatValue(0.1 + 0.2))).isEqualTo(0.1 + 0.2);
    }

    @Test
    void noSpeciesAndNoReactions_stillCompilableLayout() throws CompilationException {
        String source = generate(ReactionModel.builder().build(), GeneratorOptions.defaults());

        assertThat(source)
                .doesNotContain("enum Species")
                .contains("const int NR = 0; /* number of reactions */")
                .contains("static PropensityFun ptr[] = {NULL};");
    }

    @Test
    void configuredPrefixAndIncludes() throws CompilationException {
        GeneratorOptions options = new GeneratorOptions(List.of("solver.h"), "prop", true);

        String source = generate(BIRTH_DEATH, options);

        assertThat(source)
                .contains("#include \"solver.h\"\n")
                .doesNotContain("report.h")
                .contains("static PropensityFun ptr[] = {prop1,prop2};")
                .contains("double prop2(const int *xstate");
    }

    @Test
    void timestampCanBeDisabled() throws CompilationException {
        String source = generate(BIRTH_DEATH, GeneratorOptions.defaults().withTimestamp(false));

        assertThat(source).startsWith(PropensitySourceGenerator.MARKER + "\n\n/* Reactions:\n");
        assertThat(source).doesNotContain("Generated by");
    }

    @Test
    void generationIsDeterministicExceptForTheTimestampLine() throws CompilationException {
        Clock later = Clock.fixed(Instant.parse("2027-06-07T08:09:10Z"), ZoneOffset.UTC);
        String first = generate(BIRTH_DEATH, GeneratorOptions.defaults());
        String second = new ReactionCompiler(GeneratorOptions.defaults(), later).compile(BIRTH_DEATH).source();

        String[] a = first.split("\n", -1);
        String[] b = second.split("\n", -1);
        assertThat(a).hasSameSizeAs(b);
        for (int i = 0; i < a.length; i++) {
            if (i == 1) {
                assertThat(a[i]).startsWith("/* Generated by").isNotEqualTo(b[i]);
            } else {
                assertThat(a[i]).as("line %d", i + 1).isEqualTo(b[i]);
            }
        }
    }

    @Test
    void commentTerminatorInReactionIsDefused() throws CompilationException {
        CompilationResult result = new ReactionCompiler(GeneratorOptions.defaults(), CLOCK).compile(
                ReactionModel.builder().species("X").rate("k", 1).reaction("X > k*X*/*x*/1 > @").build());

        assertThat(result.source()).contains("     X > k*X* /*x* /1 > @\n");
    }

    @Test
    void invalidFunctionPrefix_isRejected() {
        assertThatThrownBy(() -> new GeneratorOptions(List.of(), "1fun", true))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
