package com.metadata.application.service;

import com.metadata.application.port.in.CreateUserUseCase;
import com.metadata.application.port.in.DeleteUserUseCase;
import com.metadata.application.port.in.GetUserUseCase;
import com.metadata.application.port.in.ListUsersUseCase;
import com.metadata.application.port.in.PatchUserUseCase;
import com.metadata.application.port.in.ReplaceUserUseCase;
import com.metadata.application.port.out.MetricsPort;
import com.metadata.application.port.out.UserRepository;
import com.metadata.domain.error.UserError;
import com.metadata.domain.error.ValidationError;
import com.metadata.domain.error.ValidationError.IdMutationError;
import com.metadata.domain.model.NationalId;
import com.metadata.domain.model.Result;
import com.metadata.domain.model.User;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * Mutation policy for users. Each operation validates its input, touches a single row and
 * reports expected failures as {@link UserError} values:
 * <ul>
 *   <li>create on a taken id fails with {@link UserError.AlreadyExists}</li>
 *   <li>get, replace, patch and delete on a missing id fail with {@link UserError.NotFound}, even
 *       when the request body is also invalid</li>
 *   <li>the id never changes after creation: replace accepts a body id only when it equals the
 *       path id, patch rejects any body id</li>
 * </ul>
 */
@Service
public class UserService implements
        CreateUserUseCase, GetUserUseCase, ListUsersUseCase,
        ReplaceUserUseCase, PatchUserUseCase, DeleteUserUseCase {

    private static final Logger log = LoggerFactory.getLogger(UserService.class);

    private final UserRepository userRepository;
    private final MetricsPort metrics;

    public UserService(UserRepository userRepository, MetricsPort metrics) {
        this.userRepository = userRepository;
        this.metrics = metrics;
    }

    @Override
    @Transactional
    public Result<User, UserError> createUser(Result<CreateUserCommand, ValidationError> request) {
        if (request.isFailure()) {
            return rejected(request.errorOrNull());
        }
        CreateUserCommand command = request.getOrThrow();
        log.debug("Creating user id={}", command.id());

        var userResult = User.create(command.id(), command.name(), command.phone(), command.address());
        if (userResult.isFailure()) {
            return rejected(userResult.errorOrNull());
        }

        User user = userResult.getOrThrow();
        if (!userRepository.insert(user)) {
            log.debug("User already exists: id={}", user.id());
            metrics.incrementRejectedMutations("USER_ALREADY_EXISTS");
            return Result.failure(new UserError.AlreadyExists(user.id().value()));
        }

        metrics.incrementUsersCreated();
        log.info("User created: id={}", user.id());
        return Result.success(user);
    }

    @Override
    @Transactional(readOnly = true)
    public Result<User, UserError> getUser(String id) {
        return lookup(id, false);
    }

    @Override
    @Transactional(readOnly = true)
    public List<User> listUsers() {
        List<User> users = userRepository.findAll();
        log.debug("Listing {} users", users.size());
        return users;
    }

    @Override
    @Transactional(readOnly = true)
    public List<NationalId> listUserIds() {
        return userRepository.findAllIds();
    }

    @Override
    @Transactional
    public Result<User, UserError> replaceUser(String id, Result<ReplaceUserCommand, ValidationError> request) {
        log.debug("Replacing user id={}", id);

        var existing = lookup(id, true);
        if (existing.isFailure()) {
            return existing;
        }
        if (request.isFailure()) {
            return rejected(request.errorOrNull());
        }
        User current = existing.getOrThrow();
        ReplaceUserCommand command = request.getOrThrow();

        if (command.containsId() && !current.id().value().equals(command.id())) {
            return rejected(new IdMutationError.IdChanged(current.id().value(), command.id()));
        }

        var replaced = current.replace(command.name(), command.phone(), command.address());
        if (replaced.isFailure()) {
            return rejected(replaced.errorOrNull());
        }
        return store(replaced.getOrThrow());
    }

    @Override
    @Transactional
    public Result<User, UserError> patchUser(String id, Result<PatchUserCommand, ValidationError> request) {
        log.debug("Patching user id={}", id);

        var existing = lookup(id, true);
        if (existing.isFailure()) {
            return existing;
        }
        if (request.isFailure()) {
            return rejected(request.errorOrNull());
        }
        User current = existing.getOrThrow();
        PatchUserCommand command = request.getOrThrow();

        if (command.containsId()) {
            return rejected(IdMutationError.IdInPartialUpdate.INSTANCE);
        }
        if (command.isEmpty()) {
            log.debug("Empty patch for user id={}, nothing to apply", id);
            return Result.success(current);
        }

        var patched = current.patch(command.name(), command.phone(), command.address());
        if (patched.isFailure()) {
            return rejected(patched.errorOrNull());
        }
        return store(patched.getOrThrow());
    }

    @Override
    @Transactional
    public Result<Void, UserError> deleteUser(String id) {
        log.debug("Deleting user id={}", id);

        var parsed = NationalId.parse(id);
        if (parsed.isFailure() || !userRepository.delete(parsed.getOrThrow())) {
            log.debug("Delete target not found: id={}", id);
            return Result.failure(new UserError.NotFound(id));
        }

        metrics.incrementUsersDeleted();
        log.info("User deleted: id={}", id);
        return Result.success(null);
    }

    // A path id that is not a well-formed national id cannot name a stored row.
    private Result<User, UserError> lookup(String id, boolean forUpdate) {
        var parsed = NationalId.parse(id);
        if (parsed.isFailure()) {
            log.debug("Path id is not a valid national id: {}", id);
            return Result.failure(new UserError.NotFound(id));
        }
        NationalId nationalId = parsed.getOrThrow();
        Optional<User> user = forUpdate
            ? userRepository.findByIdForUpdate(nationalId)
            : userRepository.findById(nationalId);
        return user.<Result<User, UserError>>map(Result::success)
            .orElseGet(() -> Result.failure(new UserError.NotFound(id)));
    }

    private Result<User, UserError> store(User user) {
        if (!userRepository.update(user)) {
            // Row is locked by lookup(), so it cannot disappear in between.
            throw new IllegalStateException("Locked user row vanished during update: " + user.id());
        }
        metrics.incrementUsersUpdated();
        log.info("User updated: id={}", user.id());
        return Result.success(user);
    }

    private <T> Result<T, UserError> rejected(ValidationError error) {
        log.warn("User validation failed: field={}, code={}, message={}", error.field(), error.code(), error.message());
        metrics.incrementRejectedMutations(error.code());
        return Result.failure(new UserError.ValidationFailed(error));
    }
}
