package com.metadata.application.port.in;

import com.metadata.domain.error.UserError;
import com.metadata.domain.model.Result;

public interface DeleteUserUseCase {
    Result<Void, UserError> deleteUser(String id);
}
