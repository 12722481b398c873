package bridgestore.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class DotEnvEnvironmentTest {

  @TempDir
  Path tempDir;

  @Test
  void quotedValuesDropTrailingInlineComment() {
    Map<String, String> vars = DotEnvEnvironment.parse(List.of(
        "DATABASE_URL=\"postgres://u:p@db/app\" # staging",
        "NAME='bridge' # note",
        "HASHED=\"a # b\" # c"));

    assertEquals("postgres://u:p@db/app", vars.get("DATABASE_URL"));
    assertEquals("bridge", vars.get("NAME"));
    assertEquals("a # b", vars.get("HASHED"));
  }

  @Test
  void parsesAssignmentsCommentsAndQuotes() {
    Map<String, String> vars = DotEnvEnvironment.parse(List.of(
        "# comment",
        "",
        "DATABASE_URL=postgres://u:p@db/app",
        "export PORT=8080",
        "NAME=\"quoted value\"",
        "SINGLE='x # not a comment'",
        "TRAILING=value # comment",
        "BROKEN"));

    assertEquals("postgres://u:p@db/app", vars.get("DATABASE_URL"));
    assertEquals("8080", vars.get("PORT"));
    assertEquals("quoted value", vars.get("NAME"));
    assertEquals("x # not a comment", vars.get("SINGLE"));
    assertEquals("value", vars.get("TRAILING"));
    assertFalse(vars.containsKey("BROKEN"));
  }

  @Test
  void delegateWinsOverFile() throws IOException {
    Path file = Files.writeString(tempDir.resolve(".env"), "DATABASE_URL=postgres://file/app\nOTHER=1\n");

    DotEnvEnvironment env = DotEnvEnvironment.load(file,
        Environment.of(Map.of("DATABASE_URL", "postgres://process/app")));

    assertEquals(Optional.of("postgres://process/app"), env.get("DATABASE_URL"));
    assertEquals(Optional.of("1"), env.get("OTHER"));
    assertEquals(Optional.empty(), env.get("MISSING"));
  }

  @Test
  void missingFileIsNotAnError() {
    DotEnvEnvironment env = DotEnvEnvironment.load(tempDir.resolve("absent.env"), Environment.empty());

    assertTrue(env.get("DATABASE_URL").isEmpty());
  }
}
