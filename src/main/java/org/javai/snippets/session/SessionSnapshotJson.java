package org.javai.snippets.session;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.javai.snippets.document.TextRange;

/**
 * Renders {@link SessionSnapshot}s as JSON for debugging and for embedders that
 * forward session state to another process.
 */
public class SessionSnapshotJson {

	private final ObjectMapper mapper;

	public SessionSnapshotJson() {
		this.mapper = new ObjectMapper()
				.configure(SerializationFeature.INDENT_OUTPUT, true);
	}

	public ObjectNode toJson(SessionSnapshot snapshot) {
		ObjectNode json = mapper.createObjectNode();
		json.put("state", snapshot.state().name());
		json.put("currentTabstop", snapshot.currentTabstop());
		putRange(json, snapshot.range());

		ArrayNode tabstops = json.putArray("tabstops");
		for (SessionSnapshot.TabstopState tabstop : snapshot.tabstops()) {
			ObjectNode entry = tabstops.addObject();
			entry.put("id", tabstop.id());
			entry.put("prev", tabstop.prev());
			entry.put("next", tabstop.next());
			entry.put("visited", tabstop.visited());
		}

		ArrayNode nodes = json.putArray("nodes");
		for (SessionSnapshot.NodeSnapshot node : snapshot.nodes()) {
			ObjectNode entry = nodes.addObject();
			entry.put("index", node.index());
			entry.put("parent", node.parent());
			entry.put("kind", node.kind());
			if (node.name() != null) {
				entry.put("name", node.name());
			}
			entry.put("text", node.text());
			putRange(entry, node.range());
			entry.put("highlight", node.highlight().name());
			if (node.marker() != null) {
				entry.put("marker", node.marker());
			}
		}
		return json;
	}

	/**
	 * Returns pretty-printed JSON for a snapshot.
	 */
	public String toReadableJson(SessionSnapshot snapshot) {
		if (snapshot == null) {
			return "{}";
		}
		try {
			return mapper.writeValueAsString(toJson(snapshot));
		}
		catch (JsonProcessingException e) {
			return "{\"error\": \"" + e.getMessage() + "\"}";
		}
	}

	private static void putRange(ObjectNode json, TextRange range) {
		if (range == null) {
			return;
		}
		ObjectNode node = json.putObject("range");
		node.put("start", range.start());
		node.put("end", range.end());
	}
}
