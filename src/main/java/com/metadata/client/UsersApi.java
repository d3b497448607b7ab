package com.metadata.client;

import java.util.List;
import java.util.Map;

/**
 * The complete set of user endpoints. Implementations must provide every operation, so a
 * missing endpoint is a compile error rather than a startup check.
 */
public interface UsersApi {

    /** {@code POST /api/users/} */
    ApiResponse<UserBody> create(UserBody user);

    /** {@code GET /api/users/{id}/} */
    ApiResponse<UserBody> get(String id);

    /** {@code GET /api/users/} */
    ApiResponse<List<UserBody>> list();

    /** {@code GET /api/users/ids/} */
    ApiResponse<List<String>> listIds();

    /**
     * {@code PUT /api/users/{id}/}. If {@code body} has no {@code id} key the path id is added;
     * a different id in the body is sent as-is and rejected by the server.
     */
    ApiResponse<UserBody> replace(String id, Map<String, Object> body);

    /**
     * {@code PATCH /api/users/{id}/}. {@code body} is sent verbatim; the server rejects it if it
     * contains {@code id}.
     */
    ApiResponse<UserBody> partialUpdate(String id, Map<String, Object> body);

    /** {@code DELETE /api/users/{id}/} */
    ApiResponse<Void> delete(String id);
}
