package com.metadata.adapter.in.web;

import com.fasterxml.jackson.databind.JsonNode;
import com.metadata.application.port.in.CreateUserUseCase.CreateUserCommand;
import com.metadata.application.port.in.PatchUserUseCase.PatchUserCommand;
import com.metadata.application.port.in.ReplaceUserUseCase.ReplaceUserCommand;
import com.metadata.domain.error.ValidationError;
import com.metadata.domain.error.ValidationError.FieldError;
import com.metadata.domain.error.ValidationError.PayloadError;
import com.metadata.domain.model.Result;

import java.util.Locale;

/**
 * Turns JSON request bodies into use-case commands.
 *
 * <p>Bodies are read as trees rather than bound to records so that an explicit {@code "id"} key
 * can be told apart from a missing one. String fields accept JSON strings and numbers; any other
 * JSON type is rejected. Unknown keys are ignored.
 */
final class UserPayloads {

    private UserPayloads() {}

    static Result<CreateUserCommand, ValidationError> toCreateCommand(JsonNode body) {
        return requireObject(body).flatMap(obj -> readText(obj, "id")
            .flatMap(id -> readText(obj, "name")
            .flatMap(name -> readText(obj, "phone")
            .flatMap(phone -> readText(obj, "address")
            .map(address -> new CreateUserCommand(id, name, phone, address))))));
    }

    static Result<ReplaceUserCommand, ValidationError> toReplaceCommand(JsonNode body) {
        return requireObject(body).flatMap(obj -> readText(obj, "name")
            .flatMap(name -> readText(obj, "phone")
            .flatMap(phone -> readText(obj, "address")
            .map(address -> new ReplaceUserCommand(obj.has("id"), idAsText(obj.get("id")), name, phone, address)))));
    }

    static Result<PatchUserCommand, ValidationError> toPatchCommand(JsonNode body) {
        return requireObject(body).flatMap(obj -> readText(obj, "name")
            .flatMap(name -> readText(obj, "phone")
            .flatMap(phone -> readText(obj, "address")
            .map(address -> new PatchUserCommand(obj.has("id"), name, phone, address)))));
    }

    private static Result<JsonNode, ValidationError> requireObject(JsonNode body) {
        if (body == null || !body.isObject()) {
            String type = body == null ? "null" : typeName(body);
            return Result.failure(new PayloadError.NotAnObject(type));
        }
        return Result.success(body);
    }

    // Absent keys yield a null value.
    private static Result<String, ValidationError> readText(JsonNode obj, String field) {
        JsonNode node = obj.get(field);
        if (node == null) {
            return Result.success(null);
        }
        if (node.isTextual()) {
            return Result.success(node.textValue());
        }
        if (node.isNumber()) {
            return Result.success(node.asText());
        }
        return Result.failure(new FieldError.InvalidType(field, typeName(node)));
    }

    // The body id only has to be comparable with the stored one, so every JSON type is accepted.
    private static String idAsText(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        return node.isValueNode() ? node.asText() : node.toString();
    }

    private static String typeName(JsonNode node) {
        return node.getNodeType().name().toLowerCase(Locale.ROOT);
    }
}
