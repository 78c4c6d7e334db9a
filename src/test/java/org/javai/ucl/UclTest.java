package org.javai.ucl;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.javai.ucl.value.UclNumber;
import org.javai.ucl.value.UclObject;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class UclTest {

	@TempDir
	Path dir;

	@Test
	void parsesTextWithTheDefaultParser() {
		UclObject config = Ucl.parse("[Server]\nport = 8000 + 80");

		assertThat(config.at("Server.port")).contains(UclNumber.of(8080));
	}

	@Test
	void parsesFilesWithTheDefaultParser() throws IOException {
		Path file = Files.writeString(dir.resolve("app.ucl"), "workers = 4");

		assertThat(Ucl.parseFile(file).get("workers")).isEqualTo(UclNumber.of(4));
	}

	@Test
	void printsDocuments() {
		assertThat(Ucl.print(Ucl.parse("a = 1"))).isEqualTo("a = 1\n");
	}
}
