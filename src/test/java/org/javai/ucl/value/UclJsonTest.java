package org.javai.ucl.value;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class UclJsonTest {

	@Test
	void readsStrictJsonIntoValues() throws JsonProcessingException {
		UclValue value = UclJson.readStrict("{\"a\": [1, 2.5, \"x\", null, false], \"b\": {}}");

		assertThat(value).isEqualTo(UclValue.of(Map.of(
				"a", UclArray.of(UclNumber.of(1), UclNumber.of(2.5), new UclString("x"), UclNull.INSTANCE, UclBoolean.FALSE),
				"b", new UclObject())));
	}

	@Test
	void rejectsTrailingContentAndRelaxedSyntax() {
		assertThat(UclJson.isStrictJson("{\"a\": 1}")).isTrue();
		assertThat(UclJson.isStrictJson("{\"a\": 1} extra")).isFalse();
		assertThat(UclJson.isStrictJson("{a: 1}")).isFalse();
		assertThat(UclJson.isStrictJson("['a']")).isFalse();
		assertThat(UclJson.isStrictJson("")).isFalse();
		assertThatThrownBy(() -> UclJson.readStrict("{\"a\": }")).isInstanceOf(JsonProcessingException.class);
	}

	@Test
	void writesIntegralNumbersAsIntegers() {
		JsonNode node = UclJson.toJson(UclArray.of(UclNumber.of(3), UclNumber.of(0.5)));

		assertThat(node.get(0).isIntegralNumber()).isTrue();
		assertThat(node.get(0).longValue()).isEqualTo(3L);
		assertThat(node.get(1).doubleValue()).isEqualTo(0.5);
	}

	@Test
	void rendersCompactAndPrettyText() {
		UclObject object = new UclObject();
		object.put("name", new UclString("app"));
		object.put("ports", UclArray.of(UclNumber.of(80)));

		assertThat(UclJson.toJsonString(object)).isEqualTo("{\"name\":\"app\",\"ports\":[80]}");
		assertThat(UclJson.toPrettyJsonString(object)).contains("\n").contains("\"name\" : \"app\"");
	}

	@Test
	void valuesSurviveAJsonRoundTrip() {
		UclValue original = UclValue.of(Map.of("list", List.of(1, "two", Map.of("three", 3)), "flag", true));

		assertThat(UclJson.fromJson(UclJson.toJson(original))).isEqualTo(original);
	}
}
