package com.metadata.application.port.in;

import com.metadata.domain.error.UserError;
import com.metadata.domain.error.ValidationError;
import com.metadata.domain.model.Result;
import com.metadata.domain.model.User;

public interface ReplaceUserUseCase {

    /**
     * @param request the decoded request body, or the reason it could not be decoded. A decoding
     *                failure is reported only once the user is known to exist.
     */
    Result<User, UserError> replaceUser(String id, Result<ReplaceUserCommand, ValidationError> request);

    /**
     * Full replacement of name, phone and address.
     *
     * @param containsId whether the request body carried an {@code id} key at all
     * @param id the body's {@code id} value, meaningful only when {@code containsId} is true
     */
    record ReplaceUserCommand(boolean containsId, String id, String name, String phone, String address) {}
}
