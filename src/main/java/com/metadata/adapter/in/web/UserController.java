package com.metadata.adapter.in.web;

import com.fasterxml.jackson.databind.JsonNode;
import com.metadata.application.port.in.CreateUserUseCase;
import com.metadata.application.port.in.DeleteUserUseCase;
import com.metadata.application.port.in.GetUserUseCase;
import com.metadata.application.port.in.ListUsersUseCase;
import com.metadata.application.port.in.PatchUserUseCase;
import com.metadata.application.port.in.ReplaceUserUseCase;
import com.metadata.domain.error.UserError;
import com.metadata.domain.model.NationalId;
import com.metadata.domain.model.Result;
import com.metadata.domain.model.User;
import com.metadata.infrastructure.context.RequestContext;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api")
@Tag(name = "Users", description = "User CRUD operations")
public class UserController {

    private final CreateUserUseCase createUserUseCase;
    private final GetUserUseCase getUserUseCase;
    private final ListUsersUseCase listUsersUseCase;
    private final ReplaceUserUseCase replaceUserUseCase;
    private final PatchUserUseCase patchUserUseCase;
    private final DeleteUserUseCase deleteUserUseCase;

    public UserController(
            CreateUserUseCase createUserUseCase,
            GetUserUseCase getUserUseCase,
            ListUsersUseCase listUsersUseCase,
            ReplaceUserUseCase replaceUserUseCase,
            PatchUserUseCase patchUserUseCase,
            DeleteUserUseCase deleteUserUseCase) {
        this.createUserUseCase = createUserUseCase;
        this.getUserUseCase = getUserUseCase;
        this.listUsersUseCase = listUsersUseCase;
        this.replaceUserUseCase = replaceUserUseCase;
        this.patchUserUseCase = patchUserUseCase;
        this.deleteUserUseCase = deleteUserUseCase;
    }

    @PostMapping({"/users", "/users/"})
    @Operation(summary = "Create a user", description = "Creates a user keyed by a checksum-valid Israeli ID")
    public ResponseEntity<?> createUser(@RequestBody JsonNode body) {
        Result<User, UserError> result = createUserUseCase.createUser(UserPayloads.toCreateCommand(body));

        return result.isSuccess()
            ? ResponseEntity.status(HttpStatus.CREATED).body(UserResponse.from(result.getOrThrow()))
            : toErrorResponse(result.errorOrNull());
    }

    @GetMapping({"/users", "/users/"})
    @Operation(summary = "List users", description = "Returns all users ordered by id")
    public ResponseEntity<List<UserResponse>> listUsers() {
        return ResponseEntity.ok(listUsersUseCase.listUsers().stream().map(UserResponse::from).toList());
    }

    @GetMapping({"/users/ids", "/users/ids/"})
    @Operation(summary = "List user ids", description = "Returns the ids of all users ordered by id")
    public ResponseEntity<List<String>> listUserIds() {
        return ResponseEntity.ok(listUsersUseCase.listUserIds().stream().map(NationalId::value).toList());
    }

    @GetMapping({"/users/{id}", "/users/{id}/"})
    @Operation(summary = "Get a user")
    public ResponseEntity<?> getUser(
            @Parameter(description = "User ID", example = "123456782")
            @PathVariable String id) {
        Result<User, UserError> result = getUserUseCase.getUser(id);

        return result.isSuccess()
            ? ResponseEntity.ok(UserResponse.from(result.getOrThrow()))
            : toErrorResponse(result.errorOrNull());
    }

    @PutMapping({"/users/{id}", "/users/{id}/"})
    @Operation(summary = "Replace a user",
        description = "Replaces name, phone and address. A body id is accepted only if it equals the path id")
    public ResponseEntity<?> replaceUser(
            @Parameter(description = "User ID", example = "123456782")
            @PathVariable String id,
            @RequestBody JsonNode body) {
        Result<User, UserError> result = replaceUserUseCase.replaceUser(id, UserPayloads.toReplaceCommand(body));

        return result.isSuccess()
            ? ResponseEntity.ok(UserResponse.from(result.getOrThrow()))
            : toErrorResponse(result.errorOrNull());
    }

    @PatchMapping({"/users/{id}", "/users/{id}/"})
    @Operation(summary = "Partially update a user",
        description = "Updates any subset of name, phone and address. The body must not contain id")
    public ResponseEntity<?> patchUser(
            @Parameter(description = "User ID", example = "123456782")
            @PathVariable String id,
            @RequestBody JsonNode body) {
        Result<User, UserError> result = patchUserUseCase.patchUser(id, UserPayloads.toPatchCommand(body));

        return result.isSuccess()
            ? ResponseEntity.ok(UserResponse.from(result.getOrThrow()))
            : toErrorResponse(result.errorOrNull());
    }

    @DeleteMapping({"/users/{id}", "/users/{id}/"})
    @Operation(summary = "Delete a user")
    public ResponseEntity<?> deleteUser(
            @Parameter(description = "User ID", example = "123456782")
            @PathVariable String id) {
        Result<Void, UserError> result = deleteUserUseCase.deleteUser(id);

        return result.isSuccess()
            ? ResponseEntity.noContent().build()
            : toErrorResponse(result.errorOrNull());
    }

    private ResponseEntity<ErrorResponse> toErrorResponse(UserError error) {
        HttpStatus status;
        if (error instanceof UserError.NotFound) {
            status = HttpStatus.NOT_FOUND;
        } else if (error instanceof UserError.AlreadyExists) {
            status = HttpStatus.CONFLICT;
        } else {
            status = HttpStatus.BAD_REQUEST;
        }
        return ResponseEntity.status(status)
            .body(new ErrorResponse(error.code(), error.message(), RequestContext.getRequestId()));
    }
}
