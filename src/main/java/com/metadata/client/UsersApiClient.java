package com.metadata.client;

import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link UsersApi} over HTTP.
 */
public class UsersApiClient implements UsersApi {

    private static final ParameterizedTypeReference<UserBody> USER = new ParameterizedTypeReference<>() {};
    private static final ParameterizedTypeReference<List<UserBody>> USER_LIST = new ParameterizedTypeReference<>() {};
    private static final ParameterizedTypeReference<List<String>> ID_LIST = new ParameterizedTypeReference<>() {};
    private static final ParameterizedTypeReference<Void> NO_BODY = new ParameterizedTypeReference<>() {};

    private final RestClient restClient;

    public UsersApiClient(RestClient restClient) {
        this.restClient = restClient;
    }

    @Override
    public ApiResponse<UserBody> create(UserBody user) {
        return RestResponses.exchange(
            restClient.post().uri("/api/users/").contentType(MediaType.APPLICATION_JSON).body(user),
            USER);
    }

    @Override
    public ApiResponse<UserBody> get(String id) {
        return RestResponses.exchange(restClient.get().uri("/api/users/{id}/", id), USER);
    }

    @Override
    public ApiResponse<List<UserBody>> list() {
        return RestResponses.exchange(restClient.get().uri("/api/users/"), USER_LIST);
    }

    @Override
    public ApiResponse<List<String>> listIds() {
        return RestResponses.exchange(restClient.get().uri("/api/users/ids/"), ID_LIST);
    }

    @Override
    public ApiResponse<UserBody> replace(String id, Map<String, Object> body) {
        Map<String, Object> payload = new LinkedHashMap<>(body);
        payload.putIfAbsent("id", id);
        return RestResponses.exchange(
            restClient.put().uri("/api/users/{id}/", id).contentType(MediaType.APPLICATION_JSON).body(payload),
            USER);
    }

    @Override
    public ApiResponse<UserBody> partialUpdate(String id, Map<String, Object> body) {
        return RestResponses.exchange(
            restClient.patch().uri("/api/users/{id}/", id).contentType(MediaType.APPLICATION_JSON).body(body),
            USER);
    }

    @Override
    public ApiResponse<Void> delete(String id) {
        return RestResponses.exchange(restClient.delete().uri("/api/users/{id}/", id), NO_BODY);
    }
}
