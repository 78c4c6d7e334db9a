package org.javai.ucl.internal.assemble;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import org.apache.logging.log4j.Level;
import org.javai.ucl.UclReferenceException;
import org.javai.ucl.UclSyntaxException;
import org.javai.ucl.env.EnvironmentSource;
import org.javai.ucl.testsupport.LogCaptorAppender;
import org.javai.ucl.value.UclArray;
import org.javai.ucl.value.UclBoolean;
import org.javai.ucl.value.UclNull;
import org.javai.ucl.value.UclNumber;
import org.javai.ucl.value.UclObject;
import org.javai.ucl.value.UclString;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("DocumentAssembler")
class DocumentAssemblerTest {

	private static UclObject assemble(String text) {
		List<String> lines = Arrays.asList(text.split("\n", -1));
		return new DocumentAssembler(EnvironmentSource.of(Map.of("APP_ENV", "prod")), 64).assemble(lines);
	}

	@Nested
	@DisplayName("Sections")
	class Sections {

		@Test
		@DisplayName("keys before any header live at the root")
		void rootKeys() {
			UclObject document = assemble("name = \"app\"\nversion = 2");

			assertThat(document.keySet()).containsExactly("name", "version");
			assertThat(document.get("version")).isEqualTo(UclNumber.of(2));
		}

		@Test
		@DisplayName("dotted headers create nested objects")
		void nestedSections() {
			UclObject document = assemble("""
					[Network.HTTP]
					port = 80
					[Network.HTTPS]
					port = 443
					""");

			assertThat(document.at("Network.HTTP.port")).contains(UclNumber.of(80));
			assertThat(document.at("Network.HTTPS.port")).contains(UclNumber.of(443));
		}

		@Test
		@DisplayName("whitespace inside the brackets is ignored")
		void paddedHeader() {
			UclObject document = assemble("[  Section  ]\nkey = true");

			assertThat(document.at("Section.key")).contains(UclBoolean.TRUE);
		}

		@Test
		@DisplayName("re-declaring a section merges its keys and later values win")
		void redeclaredSection() {
			UclObject document = assemble("""
					[Server]
					host = "a"
					port = 1
					[Client]
					retries = 3
					[Server]
					port = 2
					timeout = 30
					""");

			UclObject server = (UclObject) document.get("Server");
			assertThat(server.keySet()).containsExactly("host", "port", "timeout");
			assertThat(server.get("port")).isEqualTo(UclNumber.of(2));
		}

		@Test
		@DisplayName("a section over an existing scalar replaces it")
		void sectionOverScalar() {
			UclObject document = assemble("Server = 1\n[Server]\nport = 80");

			assertThat(document.at("Server.port")).contains(UclNumber.of(80));
		}
	}

	@Nested
	@DisplayName("Values")
	class Values {

		@Test
		@DisplayName("splits on the first equals sign outside quotes")
		void firstEquals() {
			UclObject document = assemble("query = \"a=b\"\nformula = x=y");

			assertThat(document.get("query")).isEqualTo(new UclString("a=b"));
			assertThat(document.get("formula")).isEqualTo(new UclString("x=y"));
		}

		@Test
		@DisplayName("an empty value is null")
		void emptyValue() {
			assertThat(assemble("key =").get("key")).isEqualTo(UclNull.INSTANCE);
		}

		@Test
		@DisplayName("references see only earlier assignments")
		void declarationOrder() {
			assertThat(assemble("a = 1\nb = a + 1").get("b")).isEqualTo(UclNumber.of(2));
			assertThatThrownBy(() -> assemble("b = a + 1\na = 1"))
					.isInstanceOf(UclReferenceException.class);
		}

		@Test
		@DisplayName("relative references resolve within the current section")
		void relativeReferences() {
			UclObject document = assemble("""
					[Calculations.Numeric]
					base = 10
					doubled = base * 2
					label = "x" + doubled
					""");

			assertThat(document.at("Calculations.Numeric.doubled")).contains(UclNumber.of(20));
			assertThat(document.at("Calculations.Numeric.label")).contains(new UclString("x20"));
		}

		@Test
		@DisplayName("reads environment values")
		void environment() {
			assertThat(assemble("env = $ENV{APP_ENV}").get("env")).isEqualTo(new UclString("prod"));
		}
	}

	@Nested
	@DisplayName("Multi-line values")
	class MultiLine {

		@Test
		@DisplayName("an object continues until its braces balance")
		void multiLineObject() {
			UclObject document = assemble("""
					[App]
					config = {
					  "name": "demo",
					  "limits": {
					    "cpu": 2
					  }
					}
					after = 1
					""");

			assertThat(document.at("App.config.limits.cpu")).contains(UclNumber.of(2));
			assertThat(document.at("App.after")).contains(UclNumber.of(1));
		}

		@Test
		@DisplayName("an array continues until its brackets balance")
		void multiLineArray() {
			UclObject document = assemble("""
					ports = [
					  80,

					  443
					]
					""");

			assertThat(document.get("ports")).isEqualTo(UclArray.of(UclNumber.of(80), UclNumber.of(443)));
		}

		@Test
		@DisplayName("brackets inside strings do not affect the balance")
		void quotedBrackets() {
			UclObject document = assemble("""
					patterns = [
					  "[a-z]]",
					  "{"
					]
					next = true
					""");

			assertThat(document.get("patterns")).isEqualTo(UclArray.of(new UclString("[a-z]]"), new UclString("{")));
			assertThat(document.get("next")).isEqualTo(UclBoolean.TRUE);
		}
	}

	@Nested
	@DisplayName("Malformed lines")
	class Malformed {

		@Test
		void lineWithoutEquals() {
			assertThatThrownBy(() -> assemble("[Server]\njust some words"))
					.isInstanceOf(UclSyntaxException.class)
					.hasMessage("Invalid syntax: line without equals sign: just some words");
		}

		@Test
		void strayStructuralFragmentIsTolerated() {
			UclObject document = assemble("a = 1\n}\nb = 2");

			assertThat(document.keySet()).containsExactly("a", "b");
		}
	}

	@Nested
	@DisplayName("Defaults block")
	class Defaults {

		@Test
		@DisplayName("fills absent and null paths and keeps existing values")
		void appliesDefaults() {
			UclObject document = assemble("""
					[Config]
					existing_key = "existing_value"
					null_key = null

					[Defaults]
					Config.existing_key = "default_value"
					Config.null_key = "default_for_null"
					Config.new_key = "new_default_value"
					Other.deep.key = 5
					""");

			assertThat(document.at("Config.existing_key")).contains(new UclString("existing_value"));
			assertThat(document.at("Config.null_key")).contains(new UclString("default_for_null"));
			assertThat(document.at("Config.new_key")).contains(new UclString("new_default_value"));
			assertThat(document.at("Other.deep.key")).contains(UclNumber.of(5));
		}

		@Test
		@DisplayName("the header is case-insensitive")
		void caseInsensitiveHeader() {
			assertThat(assemble("[DEFAULTS]\ntimeout = 30").get("timeout")).isEqualTo(UclNumber.of(30));
		}

		@Test
		@DisplayName("default values are evaluated in the last section's context")
		void evaluatedValues() {
			UclObject document = assemble("""
					[Server]
					port = 8080
					[defaults]
					Server.admin_port = port + 1
					Server.tags = [
					  "a",
					  "b"
					]
					""");

			assertThat(document.at("Server.admin_port")).contains(UclNumber.of(8081));
			assertThat(document.at("Server.tags")).contains(UclArray.of(new UclString("a"), new UclString("b")));
		}

		@Test
		@DisplayName("lines without equals signs are ignored")
		void ignoresNonAssignments() {
			assertThat(assemble("[Defaults]\nnot an assignment\nkey = 1").keySet()).containsExactly("key");
		}

		@Test
		@DisplayName("a section header after the block is a syntax error")
		void mustBeLast() {
			assertThatThrownBy(() -> assemble("[Defaults]\na = 1\n[Server]\nport = 80"))
					.isInstanceOf(UclSyntaxException.class)
					.hasMessageContaining("Defaults section must be at the end");
		}

		@Test
		@DisplayName("logs which defaults were applied")
		void logsApplication() {
			try (LogCaptorAppender appender = LogCaptorAppender.create(DefaultsTable.class, Level.DEBUG)) {
				assemble("a = 1\n[Defaults]\na = 2\nb = 3");

				assertThat(appender.messagesAt(Level.DEBUG))
						.containsExactly("Default for a skipped: value already set", "Default for b applied");
			}
		}
	}

	@Test
	@DisplayName("logs section changes at debug level")
	void logsSections() {
		try (LogCaptorAppender appender = LogCaptorAppender.create(DocumentAssembler.class, Level.DEBUG)) {
			assemble("[Network.HTTP]\nport = 80");

			assertThat(appender.messages()).contains("Entering section [Network.HTTP]");
		}
	}

	@Test
	@DisplayName("blank input assembles to an empty document")
	void emptyDocument() {
		assertThat(assemble("\n\n   \n").isEmpty()).isTrue();
	}

	@Test
	@DisplayName("key-value lines split on the first unquoted equals sign")
	void keyValueLine() {
		assertThat(KeyValueLine.split("  key  =  value = 2 ")).contains(new KeyValueLine("key", "value = 2"));
		assertThat(KeyValueLine.split("\"a=b\" = c")).contains(new KeyValueLine("\"a=b\"", "c"));
		assertThat(KeyValueLine.split("no equals")).isEmpty();
	}
}
