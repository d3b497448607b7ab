package com.metadata.application.port.in;

import com.metadata.domain.error.UserError;
import com.metadata.domain.model.Result;
import com.metadata.domain.model.User;

public interface GetUserUseCase {
    Result<User, UserError> getUser(String id);
}
