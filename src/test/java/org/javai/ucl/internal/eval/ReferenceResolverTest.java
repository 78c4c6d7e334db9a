package org.javai.ucl.internal.eval;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import java.util.Map;
import org.javai.ucl.UclReferenceException;
import org.javai.ucl.UclSyntaxException;
import org.javai.ucl.value.UclNumber;
import org.javai.ucl.value.UclObject;
import org.javai.ucl.value.UclString;
import org.javai.ucl.value.UclValue;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("ReferenceResolver")
class ReferenceResolverTest {

	private UclObject document;
	private ReferenceResolver resolver;

	@BeforeEach
	void setUp() {
		document = new UclObject();
		document.put("port", UclNumber.of(1));
		document.put("Database", UclValue.of(Map.of("host", "db.local", "port", 5432)));
		document.put("Data", UclValue.of(Map.of(
				"users", List.of(Map.of("name", "Alice"), Map.of("name", "Bob")),
				"matrix", List.of(List.of(1, 2), List.of(3, 4)),
				"config", Map.of("key", "value"))));
		document.putPath(List.of("Calculations", "Numeric", "base"), UclNumber.of(10));
		resolver = new ReferenceResolver(document);
	}

	@Nested
	@DisplayName("Simple references")
	class SimpleReferences {

		@Test
		@DisplayName("walks dotted names from the document root")
		void absolute() {
			assertThat(resolver.resolve("Database.host", SectionPath.ROOT)).isEqualTo(new UclString("db.local"));
		}

		@Test
		@DisplayName("falls back to the current section")
		void relative() {
			assertThat(resolver.resolve("host", SectionPath.parse("Database"))).isEqualTo(new UclString("db.local"));
			assertThat(resolver.resolve("base", SectionPath.parse("Calculations.Numeric"))).isEqualTo(UclNumber.of(10));
			assertThat(resolver.resolve("Numeric.base", SectionPath.parse("Calculations"))).isEqualTo(UclNumber.of(10));
		}

		@Test
		@DisplayName("prefers the absolute path over the relative one")
		void absoluteWins() {
			assertThat(resolver.resolve("port", SectionPath.parse("Database"))).isEqualTo(UclNumber.of(1));
		}

		@Test
		@DisplayName("names the reference when neither lookup succeeds")
		void unresolved() {
			assertThatThrownBy(() -> resolver.resolve("Database.user", SectionPath.parse("Database")))
					.isInstanceOf(UclReferenceException.class)
					.hasMessage("Cannot resolve reference: Database.user");
		}

		@Test
		@DisplayName("a path through a scalar does not resolve")
		void throughScalar() {
			assertThatThrownBy(() -> resolver.resolve("Database.host.length", SectionPath.ROOT))
					.isInstanceOf(UclReferenceException.class);
		}
	}

	@Nested
	@DisplayName("Complex references")
	class ComplexReferences {

		@Test
		@DisplayName("indexes an array and then a mapping key")
		void indexThenKey() {
			assertThat(resolver.resolve("Data.users[0][\"name\"]", SectionPath.ROOT)).isEqualTo(new UclString("Alice"));
			assertThat(resolver.resolve("Data.users[1]['name']", SectionPath.ROOT)).isEqualTo(new UclString("Bob"));
		}

		@Test
		@DisplayName("mixes dotted members with accessors")
		void dottedMembers() {
			assertThat(resolver.resolve("Data.users[1].name", SectionPath.ROOT)).isEqualTo(new UclString("Bob"));
			assertThat(resolver.resolve("Data.config[\"key\"]", SectionPath.ROOT)).isEqualTo(new UclString("value"));
		}

		@Test
		@DisplayName("chains indexes into nested arrays")
		void nestedArrays() {
			assertThat(resolver.resolve("Data.matrix[1][0]", SectionPath.ROOT)).isEqualTo(UclNumber.of(3));
		}

		@Test
		@DisplayName("resolves the leading name relative to the section")
		void relativeHead() {
			assertThat(resolver.resolve("users[0].name", SectionPath.parse("Data"))).isEqualTo(new UclString("Alice"));
		}

		@Test
		void indexOutOfBounds() {
			assertThatThrownBy(() -> resolver.resolve("Data.users[5]", SectionPath.ROOT))
					.isInstanceOf(UclReferenceException.class)
					.hasMessageContaining("Array index out of bounds: 5");
			assertThatThrownBy(() -> resolver.resolve("Data.users[-1]", SectionPath.ROOT))
					.isInstanceOf(UclReferenceException.class)
					.hasMessageContaining("Array index out of bounds");
		}

		@Test
		void indexIntoNonArray() {
			assertThatThrownBy(() -> resolver.resolve("Database[0]", SectionPath.ROOT))
					.isInstanceOf(UclReferenceException.class)
					.hasMessageContaining("non-array object");
		}

		@Test
		void keyOnNonObject() {
			assertThatThrownBy(() -> resolver.resolve("Database.host[\"x\"]", SectionPath.ROOT))
					.isInstanceOf(UclReferenceException.class)
					.hasMessageContaining("non-object string");
		}

		@Test
		void missingKey() {
			assertThatThrownBy(() -> resolver.resolve("Data.users[0][\"age\"]", SectionPath.ROOT))
					.isInstanceOf(UclReferenceException.class)
					.hasMessageContaining("Object key not found: 'age'");
		}

		@Test
		void unresolvedHead() {
			assertThatThrownBy(() -> resolver.resolve("Nope[0]", SectionPath.ROOT))
					.isInstanceOf(UclReferenceException.class)
					.hasMessage("Cannot resolve reference: Nope");
		}

		@Test
		void malformedAccessors() {
			assertThatThrownBy(() -> resolver.resolve("Data.users[0", SectionPath.ROOT))
					.isInstanceOf(UclSyntaxException.class)
					.hasMessageContaining("Invalid complex reference format");
			assertThatThrownBy(() -> resolver.resolve("[0]", SectionPath.ROOT))
					.isInstanceOf(UclSyntaxException.class);
		}
	}

	@Test
	void splitsComplexReferencesIntoParts() {
		assertThat(ReferenceResolver.splitComplex("Data.users[0][\"name\"].first"))
				.containsExactly("Data", ".users", "[0]", "[\"name\"]", ".first");
	}
}
