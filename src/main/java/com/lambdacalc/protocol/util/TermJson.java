package com.lambdacalc.protocol.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import com.lambdacalc.term.Term.Abstraction;
import com.lambdacalc.term.Term.Application;
import com.lambdacalc.term.Term.TermInterface;
import com.lambdacalc.term.Term.TermVisitor;
import com.lambdacalc.term.Term.Variable;

/**
 * JSON tree form of a term:
 *
 *   Variable    {"var":"x"}
 *   Abstraction {"lam":"x","body":{...}}
 *   Application {"app":[{...},{...}]}
 */
public final class TermJson {

    private static final ObjectMapper om = new ObjectMapper();

    private TermJson() {}

    public static ObjectMapper mapper() {
        return om;
    }

    public static ObjectNode toJson(TermInterface term) {
        return term.accept(new TermVisitor<ObjectNode>() {
            @Override
            public ObjectNode visitVariable(Variable t) {
                ObjectNode n = om.createObjectNode();
                n.put("var", t.name);
                return n;
            }

            @Override
            public ObjectNode visitAbstraction(Abstraction t) {
                ObjectNode n = om.createObjectNode();
                n.put("lam", t.parameter.name);
                n.set("body", t.body.accept(this));
                return n;
            }

            @Override
            public ObjectNode visitApplication(Application t) {
                ObjectNode n = om.createObjectNode();
                ArrayNode pair = n.putArray("app");
                pair.add(t.function.accept(this));
                pair.add(t.argument.accept(this));
                return n;
            }
        });
    }

    public static String toJsonString(TermInterface term) {
        try {
            return om.writeValueAsString(toJson(term));
        } catch (JsonProcessingException e) {
            throw new RuntimeException("TermJson: failed to write term", e);
        }
    }

    public static TermInterface fromJson(JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new IllegalArgumentException("TermJson: expected object, got " + describe(node));
        }
        if (node.has("var")) {
            return new Variable(text(node, "var"));
        }
        if (node.has("lam")) {
            if (!node.has("body")) throw new IllegalArgumentException("TermJson: 'lam' without 'body'");
            return new Abstraction(new Variable(text(node, "lam")), fromJson(node.get("body")));
        }
        if (node.has("app")) {
            JsonNode pair = node.get("app");
            if (!pair.isArray() || pair.size() != 2) {
                throw new IllegalArgumentException("TermJson: 'app' must be a two element array");
            }
            return new Application(fromJson(pair.get(0)), fromJson(pair.get(1)));
        }
        throw new IllegalArgumentException("TermJson: unknown term node " + node);
    }

    public static TermInterface fromJsonString(String json) {
        try {
            return fromJson(om.readTree(json));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("TermJson: invalid JSON: " + e.getOriginalMessage(), e);
        }
    }

    private static String text(JsonNode node, String field) {
        JsonNode v = node.get(field);
        if (v == null || !v.isTextual()) {
            throw new IllegalArgumentException("TermJson: '" + field + "' must be a string");
        }
        return v.asText();
    }

    private static String describe(JsonNode node) {
        return (node == null) ? "null" : node.getNodeType().toString();
    }
}
