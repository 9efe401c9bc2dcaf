package TableFill.IO;

import TableFill.Model.Automaton;
import TableFill.Model.MalformedAutomatonException;
import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON document form of an {@link Automaton}:
 * <pre>
 * {
 *   "states" : [ "q0", "q1" ],
 *   "alphabet" : [ "a" ],
 *   "start" : "q0",
 *   "accepting" : [ "q1" ],
 *   "transitions" : { "q0" : { "a" : "q1" }, "q1" : { "a" : "q1" } }
 * }
 * </pre>
 * The Portuguese keys {@code estados}, {@code alfabeto}, {@code estado_inicial}, {@code estados_finais} and
 * {@code transicoes} are read as well. Output follows the automaton's state and alphabet order, so equal
 * automata are written identically.
 */
public class JsonFormat {
    private static final ObjectMapper MAPPER = new ObjectMapper()
        .enable(SerializationFeature.INDENT_OUTPUT)
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private JsonFormat() {}

    @JsonPropertyOrder({"states", "alphabet", "start", "accepting", "transitions"})
    public static class AutomatonDocument {
        @JsonProperty("states")
        @JsonAlias("estados")
        private List<String> states;

        @JsonProperty("alphabet")
        @JsonAlias("alfabeto")
        private List<String> alphabet;

        @JsonProperty("start")
        @JsonAlias("estado_inicial")
        private String start;

        @JsonProperty("accepting")
        @JsonAlias("estados_finais")
        private List<String> accepting;

        @JsonProperty("transitions")
        @JsonAlias("transicoes")
        private LinkedHashMap<String, LinkedHashMap<String, String>> transitions;

        public AutomatonDocument() {}

        AutomatonDocument(Automaton automaton) {
            this.states = automaton.getStates();
            this.alphabet = automaton.getAlphabet();
            this.start = automaton.getStart();
            this.accepting = new ArrayList<>(automaton.getAccepting());
            this.transitions = new LinkedHashMap<>();
            for (Map.Entry<String, Map<String, String>> row : automaton.getTransitionMap().entrySet()) {
                this.transitions.put(row.getKey(), new LinkedHashMap<>(row.getValue()));
            }
        }

        Automaton toAutomaton() {
            requirePresent(states, "states");
            requirePresent(alphabet, "alphabet");
            requirePresent(start, "start");
            return new Automaton(states, alphabet, start,
                accepting == null ? List.of() : accepting,
                transitions == null ? Map.of() : transitions);
        }

        private static void requirePresent(Object value, String field) {
            if (value == null) {
                throw new MalformedAutomatonException("Automaton document has no '" + field + "'");
            }
        }
    }

    /**
     * Reads one document; the stream is closed afterwards.
     * @throws MalformedAutomatonException if the document is not valid JSON, lacks a field, or describes an
     *         invalid automaton
     */
    public static Automaton read(InputStream is) throws IOException {
        try {
            return toAutomaton(MAPPER.readValue(is, AutomatonDocument.class));
        } catch (JsonProcessingException e) {
            throw new MalformedAutomatonException("Invalid automaton document: " + e.getOriginalMessage(), e);
        }
    }

    public static Automaton read(Path path) throws IOException {
        try (InputStream is = Files.newInputStream(path)) {
            return read(is);
        }
    }

    public static Automaton fromJson(String json) {
        try {
            return toAutomaton(MAPPER.readValue(json, AutomatonDocument.class));
        } catch (JsonProcessingException e) {
            throw new MalformedAutomatonException("Invalid automaton document: " + e.getOriginalMessage(), e);
        }
    }

    private static Automaton toAutomaton(AutomatonDocument doc) {
        if (doc == null) {
            throw new MalformedAutomatonException("Empty automaton document");
        }
        return doc.toAutomaton();
    }

    /**
     * Writes one document; the stream is left open.
     */
    public static void write(Automaton automaton, OutputStream os) throws IOException {
        MAPPER.writer().without(JsonGenerator.Feature.AUTO_CLOSE_TARGET).writeValue(os, new AutomatonDocument(automaton));
    }

    public static void write(Automaton automaton, Path path) throws IOException {
        try (OutputStream os = Files.newOutputStream(path)) {
            write(automaton, os);
        }
    }

    public static String toJson(Automaton automaton) {
        try {
            return MAPPER.writeValueAsString(new AutomatonDocument(automaton));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize automaton", e);
        }
    }
}
