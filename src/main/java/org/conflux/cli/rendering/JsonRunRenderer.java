package org.conflux.cli.rendering;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.ser.std.ToStringSerializer;
import org.conflux.runtime.events.EngineEvent;
import org.conflux.runtime.model.ChainExecutionId;
import org.conflux.runtime.model.ChainExecutionStatus;
import org.conflux.runtime.model.ConverterNode;
import org.conflux.runtime.model.ProcessId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintWriter;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Writes every event and the final summary as one JSON object per line.
 * <p>
 * Each line carries {@code kind} ("event" or "summary"); event lines add the event {@code type},
 * the record name and its payload. Ids are written as plain strings.
 */
public class JsonRunRenderer implements IRunRenderer {

    private static final Logger LOG = LoggerFactory.getLogger(JsonRunRenderer.class);

    private final PrintWriter out;
    private final ObjectMapper mapper;

    public JsonRunRenderer(PrintWriter out) {
        this.out = out;
        this.mapper = createMapper();
    }

    static ObjectMapper createMapper() {
        SimpleModule ids = new SimpleModule("conflux-ids");
        ids.addSerializer(ProcessId.class, ToStringSerializer.instance);
        ids.addSerializer(ChainExecutionId.class, ToStringSerializer.instance);
        return new ObjectMapper().registerModule(ids);
    }

    @Override
    public synchronized void event(EngineEvent event) {
        ObjectNode line = mapper.createObjectNode();
        line.put("kind", "event");
        line.put("type", event.type().name());
        if (event instanceof EngineEvent.ResourceUpdated update) {
            line.put("updateType", update.updateType().name());
        }
        line.put("event", event.getClass().getSimpleName());
        line.set("payload", mapper.valueToTree(event));
        write(line);
    }

    @Override
    public synchronized void summary(List<ChainExecutionStatus> chains, List<ConverterNode> converters,
                                     Map<String, Number> metrics) {
        ObjectNode line = mapper.createObjectNode();
        line.put("kind", "summary");
        line.set("chains", mapper.valueToTree(chains));
        ObjectNode resources = line.putObject("resources");
        for (ConverterNode node : converters) {
            resources.set(node.id(), mapper.valueToTree(new TreeMap<>(node.resources())));
        }
        line.set("metrics", mapper.valueToTree(metrics));
        write(line);
    }

    private void write(ObjectNode line) {
        try {
            out.println(mapper.writeValueAsString(line));
            out.flush();
        } catch (JsonProcessingException e) {
            LOG.warn("Failed to serialize run output: {}", e.getMessage());
            LOG.debug("Serialization failure details:", e);
        }
    }
}
