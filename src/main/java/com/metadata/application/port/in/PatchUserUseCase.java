package com.metadata.application.port.in;

import com.metadata.domain.error.UserError;
import com.metadata.domain.error.ValidationError;
import com.metadata.domain.model.Result;
import com.metadata.domain.model.User;

public interface PatchUserUseCase {

    /**
     * @param request the decoded request body, or the reason it could not be decoded. A decoding
     *                failure is reported only once the user is known to exist.
     */
    Result<User, UserError> patchUser(String id, Result<PatchUserCommand, ValidationError> request);

    /**
     * Partial update. A {@code null} field is left unchanged; {@code containsId} records whether
     * the body tried to carry an {@code id} key, which is always rejected.
     */
    record PatchUserCommand(boolean containsId, String name, String phone, String address) {

        public boolean isEmpty() {
            return !containsId && name == null && phone == null && address == null;
        }
    }
}
