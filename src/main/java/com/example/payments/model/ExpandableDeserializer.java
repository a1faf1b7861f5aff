package com.example.payments.model;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.BeanProperty;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.deser.ContextualDeserializer;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;

import java.io.IOException;

/**
 * Reads an {@link Expandable} from either a JSON string (the id) or a JSON
 * object (the expanded resource).
 */
class ExpandableDeserializer extends StdDeserializer<Expandable<?>> implements ContextualDeserializer {

    private final JavaType objectType;

    ExpandableDeserializer() {
        this(null);
    }

    private ExpandableDeserializer(JavaType objectType) {
        super(Expandable.class);
        this.objectType = objectType;
    }

    @Override
    public JsonDeserializer<?> createContextual(DeserializationContext ctxt, BeanProperty property) {
        JavaType type = property != null ? property.getType() : ctxt.getContextualType();
        if (type == null || type.containedTypeCount() == 0) {
            return this;
        }
        return new ExpandableDeserializer(type.containedType(0));
    }

    @Override
    public Expandable<?> deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        if (p.currentToken() == JsonToken.VALUE_STRING) {
            return Expandable.ofId(p.getText());
        }
        if (objectType == null) {
            return (Expandable<?>) ctxt.handleUnexpectedToken(Expandable.class, p);
        }
        ApiResource resource = ctxt.readValue(p, objectType);
        return Expandable.ofObject(resource);
    }
}
