package com.anonymizer.app.router;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.cfg.CoercionAction;
import com.fasterxml.jackson.databind.cfg.CoercionInputShape;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.type.LogicalType;

import java.util.List;

/**
 * The only place typed arguments become payload documents and response
 * documents become typed results.
 * <p>
 * Decoding is strict: a missing field, an explicit null, a field the result
 * type does not know or a value of the wrong JSON type is a decoding failure.
 * Nothing is silently dropped or coerced.
 */
public class WorkerCodec {

    private final ObjectMapper encoder;
    private final ObjectMapper decoder;

    public WorkerCodec() {
        this.encoder = new ObjectMapper()
                .setSerializationInclusion(JsonInclude.Include.NON_NULL)
                .enable(SerializationFeature.FAIL_ON_EMPTY_BEANS);
        this.decoder = JsonMapper.builder()
                .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(DeserializationFeature.FAIL_ON_MISSING_CREATOR_PROPERTIES)
                .enable(DeserializationFeature.FAIL_ON_NULL_CREATOR_PROPERTIES)
                .enable(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES)
                .disable(DeserializationFeature.ACCEPT_FLOAT_AS_INT)
                .disable(MapperFeature.ALLOW_COERCION_OF_SCALARS)
                .build();
        // Numbers and booleans are not strings either
        decoder.coercionConfigFor(LogicalType.Textual)
                .setCoercion(CoercionInputShape.Integer, CoercionAction.Fail)
                .setCoercion(CoercionInputShape.Float, CoercionAction.Fail)
                .setCoercion(CoercionInputShape.Boolean, CoercionAction.Fail);
    }

    /**
     * Build the request payload for a command.
     *
     * @throws CommandException {@code ENCODING_FAILURE} when the arguments are
     *                          malformed or cannot be serialized
     */
    public <A> JsonNode encode(WorkerCommand<A, ?> command, A args) throws CommandException {
        if (args == null) {
            return encoder.createObjectNode();
        }
        if (args instanceof WorkerRequest request) {
            List<String> problems = request.validate();
            if (!problems.isEmpty()) {
                throw CommandException.invalidArguments(command.getName(), problems);
            }
        }
        try {
            return encoder.valueToTree(args);
        } catch (IllegalArgumentException e) {
            throw CommandException.encodingFailure(command.getName(), e);
        }
    }

    /**
     * Decode a response document into the command's result type.
     *
     * @throws CommandException {@code DECODING_FAILURE} carrying the raw document
     */
    public <R> R decode(WorkerCommand<?, R> command, JsonNode document) throws CommandException {
        try {
            R result = decoder.treeToValue(document, command.getResultType());
            if (result == null) {
                throw CommandException.decodingFailure(command.getName(), String.valueOf(document),
                        new IllegalStateException("empty document"));
            }
            return result;
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw CommandException.decodingFailure(command.getName(), String.valueOf(document), e);
        }
    }
}
