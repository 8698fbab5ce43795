package io.cardinal.sketch.serde;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.cardinal.sketch.ElementHasher;
import io.cardinal.sketch.HashFunctionHasher;
import io.cardinal.sketch.HllConfig;
import io.cardinal.sketch.HyperLogLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Iterator;
import java.util.Map;

/**
 * JSON form of a {@link HllVariant}, tagged by the variant name:
 * <pre>
 * "Empty"
 * {"Sparse":{"data":[[index,value],...]}}
 * {"Full":[value,...]}
 * </pre>
 * {@code {"Empty":null}} is also read as the empty variant.
 */
public final class HllJsonFormat
{
  private static final Logger LOG = LoggerFactory.getLogger(HllJsonFormat.class);

  // one document per payload, anything after it is malformed
  private static final ObjectMapper MAPPER = JsonMapper.builder()
                                                       .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
                                                       .build();

  static final String EMPTY = "Empty";
  static final String SPARSE = "Sparse";
  static final String SPARSE_DATA = "data";
  static final String FULL = "Full";

  private static final int MAX_VALUE = 0xFF;

  private HllJsonFormat()
  {
  }

  public static String toJson(HyperLogLog hll)
  {
    return toJson(HllVariantCodec.encode(hll));
  }

  public static String toJson(HllVariant variant)
  {
    try {
      return MAPPER.writeValueAsString(toTree(variant));
    }
    catch (JsonProcessingException e) {
      // trees of numbers and strings always serialize
      throw new IllegalStateException(e);
    }
  }

  public static JsonNode toTree(HllVariant variant)
  {
    switch (variant.kind()) {
      case EMPTY:
        return TextNode.valueOf(EMPTY);
      case SPARSE: {
        HllVariant.Sparse sparse = (HllVariant.Sparse) variant;
        ObjectNode root = MAPPER.createObjectNode();
        ArrayNode data = root.putObject(SPARSE).putArray(SPARSE_DATA);
        for (int entry = 0; entry < sparse.size(); entry++) {
          data.addArray()
              .add(sparse.index(entry))
              .add(sparse.value(entry) & MAX_VALUE);
        }
        return root;
      }
      case FULL: {
        HllVariant.Full full = (HllVariant.Full) variant;
        ObjectNode root = MAPPER.createObjectNode();
        ArrayNode registers = root.putArray(FULL);
        for (byte register : full.registers()) {
          registers.add(register & MAX_VALUE);
        }
        return root;
      }
      default:
        throw new IllegalStateException("unknown variant " + variant.kind());
    }
  }

  public static HyperLogLog fromJson(HllConfig config, String json) throws HllDecodeException
  {
    return fromJson(config, HashFunctionHasher.defaultHasher(), json);
  }

  public static HyperLogLog fromJson(HllConfig config, ElementHasher hasher, String json)
      throws HllDecodeException
  {
    final JsonNode root;
    try {
      root = MAPPER.readTree(json);
    }
    catch (JsonProcessingException e) {
      LOG.debug("Rejecting json sketch: {}", e.getOriginalMessage());
      throw new HllDecodeException("malformed json: " + e.getOriginalMessage(), e);
    }
    return HllVariantCodec.decode(config, hasher, fromTree(root));
  }

  public static HllVariant fromTree(JsonNode root) throws HllDecodeException
  {
    if (root == null || root.isMissingNode()) {
      throw fail("empty json document");
    }
    if (root.isTextual()) {
      if (EMPTY.equals(root.textValue())) {
        return HllVariant.empty();
      }
      throw fail("unknown variant \"" + root.textValue() + "\"");
    }
    if (!root.isObject() || root.size() != 1) {
      throw fail("expected \"Empty\" or an object with a single variant field, got " + root.getNodeType());
    }

    Map.Entry<String, JsonNode> field = root.fields().next();
    switch (field.getKey()) {
      case EMPTY:
        if (!field.getValue().isNull()) {
          throw fail("Empty carries no data, got " + field.getValue().getNodeType());
        }
        return HllVariant.empty();
      case SPARSE:
        return readSparse(field.getValue());
      case FULL:
        return readFull(field.getValue());
      default:
        throw fail("unknown variant \"" + field.getKey() + "\"");
    }
  }

  private static HllVariant readSparse(JsonNode node) throws HllDecodeException
  {
    JsonNode data = node.get(SPARSE_DATA);
    if (!node.isObject() || data == null || !data.isArray()) {
      throw fail("Sparse should be an object with a \"data\" array");
    }
    int[] indices = new int[data.size()];
    byte[] values = new byte[data.size()];
    Iterator<JsonNode> entries = data.elements();
    for (int entry = 0; entries.hasNext(); entry++) {
      JsonNode pair = entries.next();
      if (!pair.isArray() || pair.size() != 2) {
        throw fail("sparse entry " + entry + " should be an [index, value] pair");
      }
      indices[entry] = readInt(pair.get(0), HllVariant.MAX_SPARSE_INDEX, "sparse index");
      values[entry] = (byte) readInt(pair.get(1), MAX_VALUE, "sparse value");
    }
    return HllVariant.sparse(indices, values);
  }

  private static HllVariant readFull(JsonNode node) throws HllDecodeException
  {
    if (!node.isArray()) {
      throw fail("Full should be an array of register values");
    }
    byte[] registers = new byte[node.size()];
    for (int i = 0; i < registers.length; i++) {
      registers[i] = (byte) readInt(node.get(i), MAX_VALUE, "register value");
    }
    return HllVariant.full(registers);
  }

  private static int readInt(JsonNode node, int max, String what) throws HllDecodeException
  {
    if (!node.isIntegralNumber() || !node.canConvertToInt()) {
      throw fail(what + " should be an integer, got " + node);
    }
    int value = node.intValue();
    if (value < 0 || value > max) {
      throw fail(what + " " + value + " out of range [0, " + max + "]");
    }
    return value;
  }

  private static HllDecodeException fail(String message)
  {
    LOG.debug("Rejecting json sketch: {}", message);
    return new HllDecodeException(message);
  }
}
