package org.javai.ucl.value;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Bridges between {@link UclValue} trees and Jackson {@link JsonNode} trees.
 * <p>
 * Also hosts the strict JSON reader used for embedded object literals: no
 * comments, no single quotes, no trailing content after the value.
 */
public final class UclJson {

	private static final ObjectMapper mapper = new ObjectMapper()
			.enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

	private UclJson() {
	}

	/**
	 * Parses {@code text} as strict JSON.
	 *
	 * @throws JsonProcessingException if the text is not a single valid JSON value
	 */
	public static UclValue readStrict(String text) throws JsonProcessingException {
		JsonNode node = mapper.readTree(text);
		if (node == null || node.isMissingNode()) {
			throw new IllegalArgumentException("No JSON content in: " + text);
		}
		return fromJson(node);
	}

	/**
	 * Returns whether {@code text} is a single valid strict JSON value.
	 */
	public static boolean isStrictJson(String text) {
		try {
			JsonNode node = mapper.readTree(text);
			return node != null && !node.isMissingNode();
		} catch (JsonProcessingException e) {
			return false;
		}
	}

	public static UclValue fromJson(JsonNode node) {
		if (node == null || node.isNull() || node.isMissingNode()) {
			return UclNull.INSTANCE;
		}
		if (node.isBoolean()) {
			return UclBoolean.of(node.booleanValue());
		}
		if (node.isNumber()) {
			return new UclNumber(node.doubleValue());
		}
		if (node.isTextual()) {
			return new UclString(node.textValue());
		}
		if (node.isArray()) {
			List<UclValue> elements = new ArrayList<>(node.size());
			node.forEach(element -> elements.add(fromJson(element)));
			return new UclArray(elements);
		}
		if (node.isObject()) {
			UclObject object = new UclObject();
			for (Map.Entry<String, JsonNode> field : node.properties()) {
				object.put(field.getKey(), fromJson(field.getValue()));
			}
			return object;
		}
		throw new IllegalArgumentException("Unsupported JSON node: " + node.getNodeType());
	}

	public static JsonNode toJson(UclValue value) {
		JsonNodeFactory factory = mapper.getNodeFactory();
		if (value instanceof UclNull) {
			return factory.nullNode();
		}
		if (value instanceof UclBoolean bool) {
			return factory.booleanNode(bool.value());
		}
		if (value instanceof UclNumber number) {
			return number.isIntegral() && Math.abs(number.value()) < Long.MAX_VALUE
					? factory.numberNode(number.longValue())
					: factory.numberNode(number.value());
		}
		if (value instanceof UclString string) {
			return factory.textNode(string.value());
		}
		if (value instanceof UclArray array) {
			ArrayNode node = factory.arrayNode();
			array.elements().forEach(element -> node.add(toJson(element)));
			return node;
		}
		UclObject object = (UclObject) value;
		ObjectNode node = factory.objectNode();
		object.entries().forEach((key, element) -> node.set(key, toJson(element)));
		return node;
	}

	/**
	 * Renders {@code value} as compact JSON text.
	 */
	public static String toJsonString(UclValue value) {
		try {
			return mapper.writeValueAsString(toJson(value));
		} catch (JsonProcessingException e) {
			throw new IllegalStateException("Failed to render value as JSON", e);
		}
	}

	public static String toPrettyJsonString(UclValue value) {
		try {
			return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(toJson(value));
		} catch (JsonProcessingException e) {
			throw new IllegalStateException("Failed to render value as JSON", e);
		}
	}
}
