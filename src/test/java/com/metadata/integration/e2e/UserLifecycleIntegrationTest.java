package com.metadata.integration.e2e;

import com.metadata.client.ApiResponse;
import com.metadata.client.ClientConfig;
import com.metadata.client.MetadataClient;
import com.metadata.client.UserBody;
import com.metadata.client.db.UserTableClient;
import com.metadata.domain.model.NationalId;
import com.metadata.domain.model.PhoneNumber;
import com.metadata.integration.base.FullStackTestBase;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledIf;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.server.LocalServerPort;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end tests that drive the running server through {@link MetadataClient} and check
 * the table directly through {@link UserTableClient}.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@EnabledIf("isDockerAvailable")
@DisplayName("User Lifecycle E2E Tests")
class UserLifecycleIntegrationTest extends FullStackTestBase {

    private static final String PHONE = "+972501234567";

    @LocalServerPort
    private int port;

    private MetadataClient client;
    private UserTableClient table;

    @BeforeEach
    void setUp() {
        client = new MetadataClient(ClientConfig.of("http://localhost:" + port));
        table = new UserTableClient(containerStoreProperties());
    }

    @Test
    @DisplayName("Create, patch, delete, then the user is gone")
    void shouldRunFullLifecycle() {
        String id = NationalId.random().value();
        String phone = PhoneNumber.random().value();

        ApiResponse<UserBody> created = client.users().create(new UserBody(id, "A", phone, "X"));
        assertEquals(201, created.statusCode());
        assertEquals(id, created.body().id());
        assertEquals(phone, created.body().phone());
        assertTrue(table.allExist(List.of(id)));

        ApiResponse<UserBody> patched = client.users().partialUpdate(id, Map.of("address", "Y"));
        assertEquals(200, patched.statusCode());
        assertEquals("Y", patched.body().address());
        assertEquals("A", patched.body().name());
        assertEquals("Y", table.findById(id).orElseThrow().address());

        ApiResponse<Void> deleted = client.users().delete(id);
        assertEquals(204, deleted.statusCode());

        ApiResponse<UserBody> afterDelete = client.users().get(id);
        assertEquals(404, afterDelete.statusCode());
        assertEquals("USER_NOT_FOUND", afterDelete.error().error());
        assertTrue(table.findById(id).isEmpty());
    }

    @Test
    @DisplayName("Second create with the same id conflicts and keeps the first row")
    void shouldRejectDuplicateCreate() {
        String id = NationalId.random().value();
        client.users().create(new UserBody(id, "First", PHONE, "X"));

        ApiResponse<UserBody> second = client.users().create(new UserBody(id, "Second", PHONE, "Z"));

        assertEquals(409, second.statusCode());
        assertEquals("USER_ALREADY_EXISTS", second.error().error());
        assertNotNull(second.error().requestId());
        assertEquals("First", table.findById(id).orElseThrow().name());
    }

    @Test
    @DisplayName("Invalid input never reaches the table")
    void shouldRejectInvalidInput() {
        ApiResponse<UserBody> badChecksum = client.users().create(new UserBody("123456780", "A", PHONE, "X"));
        assertEquals(400, badChecksum.statusCode());
        assertEquals("ID_INVALID_CHECKSUM", badChecksum.error().error());

        ApiResponse<UserBody> badPhone = client.users().create(new UserBody("123456782", "A", "0501234567", "X"));
        assertEquals(400, badPhone.statusCode());
        assertEquals("PHONE_UNPARSEABLE", badPhone.error().error());

        assertFalse(table.allExist(List.of("123456780", "123456782")));
        assertTrue(table.findById("123456782").isEmpty());
    }

    @Test
    @DisplayName("The id cannot change through replace or patch")
    void shouldKeepIdImmutable() {
        String id = NationalId.random().value();
        client.users().create(new UserBody(id, "A", PHONE, "X"));

        ApiResponse<UserBody> replaceOther = client.users().replace(id,
            Map.of("id", "000000018", "name", "B", "phone", PHONE, "address", "Z"));
        assertEquals(400, replaceOther.statusCode());
        assertEquals("ID_IMMUTABLE", replaceOther.error().error());

        ApiResponse<UserBody> replaceSame = client.users().replace(id,
            Map.of("name", "B", "phone", PHONE, "address", "Z"));
        assertEquals(200, replaceSame.statusCode());
        assertEquals("B", replaceSame.body().name());

        ApiResponse<UserBody> patchWithId = client.users().partialUpdate(id, Map.of("id", id));
        assertEquals(400, patchWithId.statusCode());
        assertEquals("ID_NOT_ALLOWED", patchWithId.error().error());

        assertEquals("B", table.findById(id).orElseThrow().name());
        assertTrue(table.findById("000000018").isEmpty());
    }

    @Test
    @DisplayName("Listing returns every user and id in id order")
    void shouldListUsersAndIds() {
        client.users().create(new UserBody("123456782", "B", PHONE, "X"));
        client.users().create(new UserBody("000000018", "A", PHONE, "X"));

        assertEquals(List.of("000000018", "123456782"), client.users().listIds().body());
        assertEquals(2, client.users().list().body().size());
        assertEquals("A", client.users().list().body().get(0).name());
    }

    @Test
    @DisplayName("Mutations on a missing user report not found")
    void shouldReportMissingUser() {
        String id = NationalId.random().value();

        assertEquals(404, client.users().get(id).statusCode());
        assertEquals(404, client.users().replace(id, Map.of("name", "A", "phone", PHONE, "address", "X")).statusCode());
        assertEquals(404, client.users().partialUpdate(id, Map.of("address", "Y")).statusCode());
        assertEquals(404, client.users().delete(id).statusCode());
        assertEquals(404, client.users().get("not-an-id").statusCode());
    }

    @Test
    @DisplayName("A missing user is reported before a malformed body")
    void shouldReportMissingUserBeforeBodyErrors() {
        String missing = NationalId.random().value();
        Map<String, Object> booleanName = Map.of("name", true, "phone", PHONE, "address", "X");

        ApiResponse<UserBody> replaceMissing = client.users().replace(missing, booleanName);
        assertEquals(404, replaceMissing.statusCode());
        assertEquals("USER_NOT_FOUND", replaceMissing.error().error());
        assertEquals(404, client.users().partialUpdate(missing, Map.of("phone", "abc")).statusCode());

        String id = NationalId.random().value();
        client.users().create(new UserBody(id, "A", PHONE, "X"));

        ApiResponse<UserBody> replaceExisting = client.users().replace(id, booleanName);
        assertEquals(400, replaceExisting.statusCode());
        assertEquals("FIELD_INVALID_TYPE", replaceExisting.error().error());
        assertEquals("A", table.findById(id).orElseThrow().name());
    }

    @Test
    @DisplayName("Health endpoint answers ok")
    void shouldReportHealthy() {
        assertTrue(client.health().check().body().isOk());
    }

    @Test
    @DisplayName("Concurrent creates of one id yield exactly one success")
    void shouldAllowOnlyOneConcurrentCreate() throws Exception {
        String id = NationalId.random().value();
        int attempts = 8;
        ExecutorService executor = Executors.newFixedThreadPool(attempts);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<Integer>> futures = new ArrayList<>();
            for (int i = 0; i < attempts; i++) {
                String name = "Racer " + i;
                Callable<Integer> create = () -> {
                    start.await();
                    return client.users().create(new UserBody(id, name, PHONE, "X")).statusCode();
                };
                futures.add(executor.submit(create));
            }
            start.countDown();

            int created = 0;
            int conflicts = 0;
            for (Future<Integer> future : futures) {
                int status = future.get();
                if (status == 201) {
                    created++;
                } else if (status == 409) {
                    conflicts++;
                }
            }
            assertEquals(1, created);
            assertEquals(attempts - 1, conflicts);
        } finally {
            executor.shutdownNow();
        }
        assertTrue(table.allExist(List.of(id)));
    }

    @Test
    @DisplayName("Concurrent patches to different fields are all kept")
    void shouldSerializeConcurrentPatches() throws Exception {
        String id = NationalId.random().value();
        client.users().create(new UserBody(id, "A", PHONE, "X"));

        ExecutorService executor = Executors.newFixedThreadPool(2);
        CountDownLatch start = new CountDownLatch(1);
        try {
            Future<Integer> nameChange = executor.submit(() -> {
                start.await();
                return client.users().partialUpdate(id, Map.of("name", "N")).statusCode();
            });
            Future<Integer> addressChange = executor.submit(() -> {
                start.await();
                return client.users().partialUpdate(id, Map.of("address", "Y")).statusCode();
            });
            start.countDown();

            assertEquals(200, nameChange.get());
            assertEquals(200, addressChange.get());
        } finally {
            executor.shutdownNow();
        }

        var row = table.findById(id).orElseThrow();
        assertEquals("N", row.name());
        assertEquals("Y", row.address());
    }
}
