package org.lakeshift.migration.file;

import org.lakeshift.exception.MigrationParseException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MigrationFileParserTest {

    @TempDir
    Path tempDir;

    private MigrationFileParser parser;

    @BeforeEach
    void setUp() {
        parser = new MigrationFileParser();
    }

    @Test
    @DisplayName("V001__create_users.sql 은 버전 1, 이름 create_users")
    void parsesVersionAndName() {
        MigrationFile file = parser.parse("CREATE TABLE x (a INT);", "V001__create_users.sql");

        assertThat(file.version()).isEqualTo(1);
        assertThat(file.name()).isEqualTo("create_users");
        assertThat(file.label()).isEqualTo("V1__create_users");
        assertThat(file.checksum()).hasSize(64).matches("[0-9a-f]+");
    }

    @ParameterizedTest
    @ValueSource(strings = {"V1_bad.sql", "001__no_v.sql", "V1__x.txt", "v1__lower.sql", "V__noversion.sql"})
    void rejectsInvalidFilenames(String filename) {
        assertThatThrownBy(() -> parser.parse("SELECT 1;", filename))
                .isInstanceOf(MigrationParseException.class)
                .hasMessageContaining("Invalid filename '" + filename + "'")
                .hasMessageContaining("V<version>__name.sql");
    }

    @Test
    void rejectsEmptyContent() {
        assertThatThrownBy(() -> parser.parse("  \n\t", "V2__empty.sql"))
                .isInstanceOf(MigrationParseException.class)
                .hasMessage("Migration file 'V2__empty.sql' is empty.");
    }

    @Test
    @DisplayName("줄바꿈 형식이 달라도 checksum 동일")
    void checksumIgnoresLineEndings() {
        String lf = parser.parse("SELECT 1;\nSELECT 2;\n", "V1__a.sql").checksum();
        String crlf = parser.parse("SELECT 1;\r\nSELECT 2;\r\n", "V1__a.sql").checksum();
        String cr = parser.parse("SELECT 1;\rSELECT 2;\r", "V1__a.sql").checksum();

        assertThat(crlf).isEqualTo(lf);
        assertThat(cr).isEqualTo(lf);
        assertThat(parser.parse("SELECT 3;\n", "V1__a.sql").checksum()).isNotEqualTo(lf);
    }

    @Test
    void checksumOfKnownContent() {
        assertThat(Checksums.sha256("abc"))
                .isEqualTo("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad");
    }

    @Test
    @DisplayName("디렉토리의 마이그레이션은 숫자 버전 순으로 정렬")
    void directoryIsSortedNumerically() throws IOException {
        Files.writeString(tempDir.resolve("V10__ten.sql"), "SELECT 10;");
        Files.writeString(tempDir.resolve("V2__two.sql"), "SELECT 2;");
        Files.writeString(tempDir.resolve("V1__one.sql"), "SELECT 1;");
        Files.writeString(tempDir.resolve("README.md"), "notes");
        Files.writeString(tempDir.resolve("helper.sql"), "SELECT 0;");

        List<MigrationFile> files = parser.parseDirectory(tempDir);

        assertThat(files).extracting(MigrationFile::version).containsExactly(1, 2, 10);
        assertThat(files.get(0).path()).isEqualTo(tempDir.resolve("V1__one.sql"));
        assertThat(files.get(0).sql()).isEqualTo("SELECT 1;");
    }

    @Test
    void duplicateVersionsFail() throws IOException {
        Files.writeString(tempDir.resolve("V1__one.sql"), "SELECT 1;");
        Files.writeString(tempDir.resolve("V001__other.sql"), "SELECT 1;");

        assertThatThrownBy(() -> parser.parseDirectory(tempDir))
                .isInstanceOf(MigrationParseException.class)
                .hasMessageStartingWith("Duplicate version 1:");
    }

    @Test
    void missingDirectoryIsEmpty() {
        assertThat(parser.parseDirectory(tempDir.resolve("nope"))).isEmpty();
    }

    @Test
    void emptyFileInDirectoryFails() throws IOException {
        Files.writeString(tempDir.resolve("V1__blank.sql"), "");

        assertThatThrownBy(() -> parser.parseDirectory(tempDir))
                .isInstanceOf(MigrationParseException.class)
                .hasMessageContaining("is empty");
    }
}
