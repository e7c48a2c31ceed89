package cafe.woden.multisplit.persist;

import cafe.woden.multisplit.api.NodeId;
import cafe.woden.multisplit.api.Orientation;
import cafe.woden.multisplit.api.PaneId;
import cafe.woden.multisplit.api.WidgetId;
import cafe.woden.multisplit.model.LeafNode;
import cafe.woden.multisplit.model.PaneIdGenerator;
import cafe.woden.multisplit.model.PaneNode;
import cafe.woden.multisplit.model.PaneTrees;
import cafe.woden.multisplit.model.SizeConstraints;
import cafe.woden.multisplit.model.SplitNode;
import cafe.woden.multisplit.model.TreeState;
import cafe.woden.multisplit.model.TreeValidator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads and writes pane layouts as JSON.
 *
 * <pre>
 * { "version": "1.0.0",
 *   "root": node | null,
 *   "focused_pane_id": "id" | null }
 * node := { "type": "split", "node_id": "id", "orientation": "horizontal" | "vertical",
 *           "ratios": [..], "children": [node, ..] }
 *       | { "type": "leaf", "pane_id": "id", "widget_id": "id",
 *           "constraints": { "min_width": n, "min_height": n } }
 * </pre>
 *
 * <p>The maximized pane is never written; a decoded layout is always in normal mode. {@code
 * node_id} and {@code constraints} are optional on read.
 */
public final class LayoutJsonCodec {

  private static final Logger log = LoggerFactory.getLogger(LayoutJsonCodec.class);

  public static final String FORMAT_VERSION = "1.0.0";

  private static final int MAX_ID_ATTEMPTS = 64;

  private final ObjectMapper mapper;
  private final SizeConstraints defaultConstraints;

  public LayoutJsonCodec(ObjectMapper mapper, SizeConstraints defaultConstraints) {
    this.mapper = Objects.requireNonNull(mapper, "mapper");
    this.defaultConstraints = defaultConstraints == null ? SizeConstraints.NONE : defaultConstraints;
  }

  public LayoutJsonCodec() {
    this(new ObjectMapper(), SizeConstraints.NONE);
  }

  public ObjectNode toJsonNode(TreeState state) {
    Objects.requireNonNull(state, "state");
    ObjectNode out = mapper.createObjectNode();
    out.put("version", FORMAT_VERSION);
    if (state.root() == null) {
      out.putNull("root");
    } else {
      out.set("root", encodeNode(state.root()));
    }
    if (state.focusedPaneId() == null) {
      out.putNull("focused_pane_id");
    } else {
      out.put("focused_pane_id", state.focusedPaneId().value());
    }
    return out;
  }

  public String encode(TreeState state) {
    try {
      return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(toJsonNode(state));
    } catch (JsonProcessingException e) {
      // A tree of strings and numbers always serializes.
      throw new IllegalStateException("could not serialize layout", e);
    }
  }

  public TreeState decode(String json) throws LayoutFormatException {
    return decode(json, PaneIdGenerator.random("pane"));
  }

  /**
   * Parses a layout. Splits saved without a {@code node_id} get one from {@code ids}. Focus
   * falls back to the first leaf when missing or unknown.
   */
  public TreeState decode(String json, PaneIdGenerator ids) throws LayoutFormatException {
    Objects.requireNonNull(ids, "ids");
    JsonNode doc;
    try {
      doc = mapper.readTree(Objects.toString(json, ""));
    } catch (JsonProcessingException e) {
      throw new LayoutFormatException("layout is not valid JSON: " + e.getOriginalMessage(), e);
    }
    return decode(doc, ids);
  }

  public TreeState decode(JsonNode doc, PaneIdGenerator ids) throws LayoutFormatException {
    if (doc == null || !doc.isObject()) {
      throw new LayoutFormatException("layout must be a JSON object");
    }
    checkVersion(doc.path("version").asText(FORMAT_VERSION));

    JsonNode rootJson = doc.get("root");
    if (rootJson == null || rootJson.isNull()) return TreeState.EMPTY;

    Set<NodeId> nodeIds = new HashSet<>();
    for (JsonNode v : rootJson.findValues("node_id")) {
      if (v.isTextual() && !v.asText().isBlank()) nodeIds.add(new NodeId(v.asText()));
    }
    PaneNode root = decodeNode(rootJson, ids, nodeIds, "root");
    PaneId focused = null;
    JsonNode focusJson = doc.get("focused_pane_id");
    if (focusJson != null && focusJson.isTextual() && !focusJson.asText().isBlank()) {
      PaneId requested = new PaneId(focusJson.asText());
      if (PaneTrees.findLeaf(root, requested).isPresent()) {
        focused = requested;
      } else {
        log.debug("[multisplit] saved focus {} is not in the layout; using the first pane", requested);
      }
    }
    if (focused == null) focused = PaneTrees.firstLeaf(root).paneId();

    TreeState state = new TreeState(root, focused, null);
    List<String> violations = TreeValidator.validate(state);
    if (!violations.isEmpty()) {
      throw new LayoutFormatException("layout breaks tree invariants: " + String.join("; ", violations));
    }
    return state;
  }

  private static void checkVersion(String version) throws LayoutFormatException {
    String major = version.split("\\.", 2)[0].trim();
    if (!"1".equals(major)) {
      throw new LayoutFormatException("incompatible layout version: " + version);
    }
  }

  private ObjectNode encodeNode(PaneNode node) {
    ObjectNode out = mapper.createObjectNode();
    if (node instanceof LeafNode leaf) {
      out.put("type", "leaf");
      out.put("pane_id", leaf.paneId().value());
      out.put("widget_id", leaf.widgetId().value());
      ObjectNode c = out.putObject("constraints");
      c.put("min_width", leaf.constraints().minWidth());
      c.put("min_height", leaf.constraints().minHeight());
    } else if (node instanceof SplitNode split) {
      out.put("type", "split");
      out.put("node_id", split.nodeId().value());
      out.put("orientation", split.orientation().wireName());
      ArrayNode ratios = out.putArray("ratios");
      split.ratios().forEach(ratios::add);
      ArrayNode children = out.putArray("children");
      split.children().forEach(child -> children.add(encodeNode(child)));
    }
    return out;
  }

  private PaneNode decodeNode(
      JsonNode json, PaneIdGenerator ids, Set<NodeId> nodeIds, String path)
      throws LayoutFormatException {
    if (!json.isObject()) throw new LayoutFormatException(path + ": node must be an object");
    String type = json.path("type").asText("");
    return switch (type) {
      case "leaf" -> decodeLeaf(json, path);
      case "split" -> decodeSplit(json, ids, nodeIds, path);
      default -> throw new LayoutFormatException(path + ": unknown node type '" + type + "'");
    };
  }

  private LeafNode decodeLeaf(JsonNode json, String path) throws LayoutFormatException {
    String paneId = requireText(json, "pane_id", path);
    JsonNode widgetJson = json.get("widget_id");
    if (widgetJson == null || widgetJson.isNull() || !widgetJson.isValueNode()) {
      throw new LayoutFormatException(path + ": missing widget_id");
    }
    SizeConstraints constraints = defaultConstraints;
    JsonNode c = json.get("constraints");
    if (c != null && c.isObject()) {
      int minWidth = c.path("min_width").asInt(defaultConstraints.minWidth());
      int minHeight = c.path("min_height").asInt(defaultConstraints.minHeight());
      if (minWidth < 0 || minHeight < 0) {
        throw new LayoutFormatException(path + ": constraints must be non-negative");
      }
      constraints = new SizeConstraints(minWidth, minHeight);
    }
    return new LeafNode(new PaneId(paneId), new WidgetId(widgetJson.asText()), constraints);
  }

  private SplitNode decodeSplit(
      JsonNode json, PaneIdGenerator ids, Set<NodeId> nodeIds, String path)
      throws LayoutFormatException {
    Orientation orientation;
    try {
      orientation = Orientation.fromWireName(requireText(json, "orientation", path));
    } catch (IllegalArgumentException e) {
      throw new LayoutFormatException(path + ": " + e.getMessage(), e);
    }

    JsonNode ratiosJson = json.get("ratios");
    JsonNode childrenJson = json.get("children");
    if (ratiosJson == null || !ratiosJson.isArray()) {
      throw new LayoutFormatException(path + ": ratios must be an array");
    }
    if (childrenJson == null || !childrenJson.isArray()) {
      throw new LayoutFormatException(path + ": children must be an array");
    }
    List<Double> ratios = new ArrayList<>(ratiosJson.size());
    for (JsonNode r : ratiosJson) {
      if (!r.isNumber()) throw new LayoutFormatException(path + ": ratios must be numbers");
      ratios.add(r.asDouble());
    }
    List<PaneNode> children = new ArrayList<>(childrenJson.size());
    for (int i = 0; i < childrenJson.size(); i++) {
      String childPath = path + ".children[" + i + "]";
      children.add(decodeNode(childrenJson.get(i), ids, nodeIds, childPath));
    }

    String rawNodeId = json.path("node_id").asText("");
    NodeId nodeId =
        rawNodeId.isBlank() ? freshNodeId(ids, nodeIds, path) : new NodeId(rawNodeId);
    return new SplitNode(nodeId, orientation, ratios, children);
  }

  /** Next generated id not written anywhere in the document nor handed out earlier. */
  private static NodeId freshNodeId(PaneIdGenerator ids, Set<NodeId> nodeIds, String path)
      throws LayoutFormatException {
    int attempts = nodeIds.size() + MAX_ID_ATTEMPTS;
    for (int i = 0; i < attempts; i++) {
      NodeId candidate = ids.nextNodeId();
      if (nodeIds.add(candidate)) return candidate;
    }
    throw new LayoutFormatException(path + ": could not assign a free node_id");
  }

  private static String requireText(JsonNode json, String field, String path)
      throws LayoutFormatException {
    JsonNode v = json.get(field);
    if (v == null || !v.isTextual() || v.asText().isBlank()) {
      throw new LayoutFormatException(path + ": missing " + field);
    }
    return v.asText();
  }
}
