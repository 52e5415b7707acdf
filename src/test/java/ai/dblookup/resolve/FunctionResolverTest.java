package ai.dblookup.resolve;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import ai.dblookup.model.FunctionMatch;
import ai.dblookup.model.FunctionRecord;
import ai.dblookup.model.Lookup;
import ai.dblookup.model.TableSchema;
import ai.dblookup.scan.DatabaseAccessException;
import ai.dblookup.testutil.TestDatabase;

import static ai.dblookup.testutil.TestDatabase.row;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class FunctionResolverTest {

    private final FunctionResolver resolver = new FunctionResolver();

    @Nested
    @DisplayName("byLine")
    class ByLine {

        @TempDir
        Path tempDir;

        private Path tree;

        @BeforeEach
        void setUp() throws IOException {
            tree = TestDatabase.in(tempDir)
                    .table(TableSchema.FUNCTION_TREE,
                            TestDatabase.header(TableSchema.FUNCTION_TREE),
                            row("outer", "/src/net.c", "1", "fn_1", "10", "fn_0"),
                            row("inner", "/src/net.c", "5", "fn_2", "15", "fn_1"),
                            row("other", "/src/io.c", "1", "fn_3", "100", "fn_0"))
                    .tablePath(TableSchema.FUNCTION_TREE);
        }

        @Test
        void overlappingRanges_earlierRowWins() throws IOException {
            final var hit = resolver.byLine(tree, "net.c", 7);

            assertThat(hit).map(FunctionRecord::functionName).contains("\"outer\"");
        }

        @Test
        void lineOutsideFirstRange_fallsThroughToLaterRow() throws IOException {
            assertThat(resolver.byLine(tree, "net.c", 12)).map(FunctionRecord::functionId).contains("\"fn_2\"");
        }

        @Test
        void rangeBoundsAreInclusive() throws IOException {
            assertThat(resolver.byLine(tree, "net.c", 1)).map(FunctionRecord::functionName).contains("\"outer\"");
            assertThat(resolver.byLine(tree, "net.c", 15)).map(FunctionRecord::functionName).contains("\"inner\"");
        }

        @Test
        void fileMustAppearInRow() throws IOException {
            assertThat(resolver.byLine(tree, "io.c", 7)).map(FunctionRecord::functionName).contains("\"other\"");
            assertThat(resolver.byLine(tree, "missing.c", 7)).isEmpty();
        }

        @Test
        void noCoveringRange_isAbsent() throws IOException {
            assertThat(resolver.byLine(tree, "net.c", 16)).isEmpty();
        }

        @Test
        void malformedAndNonNumericRows_areSkipped() throws IOException {
            final Path messy = TestDatabase.in(tempDir.resolve("messy"))
                    .table(TableSchema.FUNCTION_TREE,
                            "\"broken\",\"/src/net.c\"",
                            row("nonnum", "/src/net.c", "one", "fn_8", "ten", "fn_0"),
                            row("good", "/src/net.c", "1", "fn_9", "10", "fn_0"))
                    .tablePath(TableSchema.FUNCTION_TREE);

            assertThat(resolver.byLine(messy, "net.c", 3)).map(FunctionRecord::functionName).contains("\"good\"");
        }

        @Test
        void missingTable_raisesAccessError() {
            final Path missing = tempDir.resolve("nowhere").resolve("FunctionTree.csv");

            assertThatThrownBy(() -> resolver.byLine(missing, "net.c", 1))
                    .isInstanceOf(DatabaseAccessException.class)
                    .hasMessage("Function tree file not found: " + missing);
        }
    }

    @Nested
    @DisplayName("byId")
    class ById {

        @TempDir
        Path tempDir;

        @Test
        void matchesFunctionIdColumnOnly() throws IOException {
            final Path tree = TestDatabase.in(tempDir)
                    .table(TableSchema.FUNCTION_TREE,
                            row("callee", "/src/a.c", "20", "fn_5", "30", "fn_4"),
                            row("caller", "/src/a.c", "1", " fn_4 ", "10", "fn_0"))
                    .tablePath(TableSchema.FUNCTION_TREE);

            assertThat(resolver.byId(tree, "fn_4")).map(FunctionRecord::functionName).contains("\"caller\"");
            assertThat(resolver.byId(tree, "fn_6")).isEmpty();
        }
    }

    @Nested
    @DisplayName("byName")
    class ByName {

        @TempDir
        Path tempDir;

        private Path tree;
        private FunctionRecord process;

        @BeforeEach
        void setUp() throws IOException {
            tree = TestDatabase.in(tempDir)
                    .table(TableSchema.FUNCTION_TREE,
                            row("process", "/src/net.c", "20", "fn_1", "40", "fn_0"),
                            row("parse_header_ext", "/src/net.c", "70", "fn_3", "80", "fn_1"),
                            row("parse_header", "/src/net.c", "50", "fn_2", "60", "fn_1"),
                            row("unrelated_parse_header", "/src/x.c", "1", "fn_7", "9", "fn_6"))
                    .tablePath(TableSchema.FUNCTION_TREE);
            process = new FunctionRecord("\"process\"", "\"/src/net.c\"", "\"20\"", "\"fn_1\"", "\"40\"", "\"fn_0\"");
        }

        @Test
        void exactMatch_beatsEarlierSubstringMatch() throws IOException {
            final Lookup<FunctionMatch> result = resolver.byName(tree, "parse_header", List.of(process));

            assertThat(result.asOptional()).hasValueSatisfying(m -> {
                assertThat(m.function().functionId()).isEqualTo("\"fn_2\"");
                assertThat(m.via()).isSameAs(process);
            });
        }

        @Test
        void namespaceIsStrippedFromSearchTerm() throws IOException {
            final var result = resolver.byName(tree, "net::Parser::parse_header", List.of(process));

            assertThat(result.asOptional()).map(m -> m.function().functionId()).contains("\"fn_2\"");
        }

        @Test
        void returnedRecordKeepsQuotes() throws IOException {
            final var result = resolver.byName(tree, "parse_header", List.of(process));

            assertThat(result.asOptional()).map(m -> m.function().functionName()).contains("\"parse_header\"");
        }

        @Test
        void substringFallback_runsAfterStrictMiss() throws IOException {
            final var result = resolver.byName(tree, "header_ext", List.of(process));

            assertThat(result.asOptional()).map(m -> m.function().functionId()).contains("\"fn_3\"");
        }

        @Test
        void lessStrict_matchesBySubstringImmediately() throws IOException {
            final var result = resolver.byName(tree, "parse_header", List.of(process), true);

            assertThat(result.asOptional()).map(m -> m.function().functionId()).contains("\"fn_3\"");
        }

        @Test
        void onlyRowsRelatedToKnownFunctionsAreConsidered() throws IOException {
            final var result = resolver.byName(tree, "unrelated_parse_header", List.of(process));

            assertThat(result.isFound()).isFalse();
        }

        @Test
        void knownFunctionsAreTriedInOrder() throws IOException {
            final FunctionRecord stranger =
                    new FunctionRecord("\"stranger\"", "\"/src/y.c\"", "\"1\"", "\"fn_99\"", "\"2\"", "\"fn_0\"");

            final var result = resolver.byName(tree, "parse_header", List.of(stranger, process));

            assertThat(result.asOptional()).map(FunctionMatch::via).contains(process);
        }

        @Test
        void unknownName_yieldsNotFoundMessage() throws IOException {
            final var result = resolver.byName(tree, "ns::missing_fn", List.of(process));

            assertThat(result).isInstanceOfSatisfying(Lookup.NotFound.class, nf -> assertThat(nf.message())
                    .isEqualTo("Function 'ns::missing_fn' not found. Make sure you're using the correct tool and args."));
        }
    }
}
