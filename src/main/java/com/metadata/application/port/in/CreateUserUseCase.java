package com.metadata.application.port.in;

import com.metadata.domain.error.UserError;
import com.metadata.domain.error.ValidationError;
import com.metadata.domain.model.Result;
import com.metadata.domain.model.User;

public interface CreateUserUseCase {

    /**
     * @param request the decoded request body, or the reason it could not be decoded
     */
    Result<User, UserError> createUser(Result<CreateUserCommand, ValidationError> request);

    /**
     * Raw create input. A {@code null} field was not supplied by the caller.
     */
    record CreateUserCommand(String id, String name, String phone, String address) {}
}
