package com.example.vaultkv2.core.http;

import static com.example.vaultkv2.core.TestSupport.ADDRESS;
import static com.example.vaultkv2.core.TestSupport.TOKEN;
import static com.example.vaultkv2.core.TestSupport.connection;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

import com.example.vaultkv2.core.connection.VaultConnection;
import com.example.vaultkv2.core.kv.CheckAndSet;
import com.example.vaultkv2.core.kv.SecretData;
import com.example.vaultkv2.core.kv.SecretPath;
import com.example.vaultkv2.core.kv.SecretVersion;
import com.example.vaultkv2.core.kv.SecretVersions;
import java.net.URI;
import java.net.http.HttpClient;
import java.util.Map;
import org.junit.jupiter.api.*;

public class VaultRequestsTest {

  private static final SecretPath PATH = new SecretPath("app/db");

  private VaultConnection connection;

  @BeforeEach
  void setUp() {
    connection = connection(mock(HttpClient.class));
  }

  @Nested
  @DisplayName("Write body")
  class WriteBody {

    private VaultRequest write(final CheckAndSet cas) {
      return VaultRequests.writeSecret(
          connection, cas, PATH, new SecretData(Map.of("my", "password")));
    }

    @Test
    @DisplayName("WriteAllowed omits the cas option")
    void writeAllowedOmitsCas() {
      final var body = write(CheckAndSet.WRITE_ALLOWED).body();

      assertTrue(body.path("options").isObject());
      assertFalse(body.path("options").has("cas"));
    }

    @Test
    @DisplayName("CreateOnly sends cas 0")
    void createOnlySendsZero() {
      assertEquals(0, write(CheckAndSet.CREATE_ONLY).body().path("options").path("cas").intValue());
    }

    @Test
    @DisplayName("CurrentVersion(n) sends cas n")
    void currentVersionSendsN() {
      assertEquals(
          5, write(CheckAndSet.currentVersion(5)).body().path("options").path("cas").intValue());
    }

    @Test
    @DisplayName("data is sent as a JSON object")
    void dataIsObject() {
      final var request = write(CheckAndSet.WRITE_ALLOWED);

      assertEquals("password", request.body().path("data").path("my").asText());
      assertEquals("POST", request.method());
      assertEquals(URI.create(ADDRESS + "/v1/secret/data/app/db"), request.uri());
      assertEquals("application/json", request.headers().get("Content-Type"));
    }
  }

  @Test
  @DisplayName("every request carries the token header")
  void tokenHeader() {
    final var read = VaultRequests.readSecret(connection, PATH, null);
    final var config = VaultRequests.engineConfig(connection, 1, true);

    assertEquals(TOKEN, read.headers().get("X-Vault-Token"));
    assertEquals(TOKEN, config.headers().get("X-Vault-Token"));
  }

  @Test
  @DisplayName("requests without body carry no content type")
  void noContentTypeWithoutBody() {
    final var request = VaultRequests.deleteSecret(connection, PATH);

    assertTrue(request.jsonBody().isEmpty());
    assertFalse(request.headers().containsKey("Content-Type"));
    assertEquals("DELETE", request.method());
  }

  @Test
  @DisplayName("read requests add the version query only for explicit versions")
  void readQuery() {
    assertEquals(
        URI.create(ADDRESS + "/v1/secret/data/app/db"),
        VaultRequests.readSecret(connection, PATH, null).uri());
    assertEquals(
        URI.create(ADDRESS + "/v1/secret/data/app/db?version=2"),
        VaultRequests.readSecret(connection, PATH, new SecretVersion(2)).uri());
  }

  @Test
  @DisplayName("version operations send the versions in order")
  void versionsBody() {
    final var request =
        VaultRequests.secretVersions(
            connection, OperationSegment.UNDELETE, PATH, SecretVersions.of(3, 1, 2));

    assertEquals("[3,1,2]", request.body().path("versions").toString());
    assertEquals(URI.create(ADDRESS + "/v1/secret/undelete/app/db"), request.uri());
  }

  @Test
  @DisplayName("config requests send max_versions and cas_required")
  void configBody() {
    final var engine = VaultRequests.engineConfig(connection, 10, true);
    final var secret = VaultRequests.secretConfig(connection, PATH, 3, false);

    assertEquals("{\"max_versions\":10,\"cas_required\":true}", engine.body().toString());
    assertEquals(URI.create(ADDRESS + "/v1/secret/config"), engine.uri());
    assertEquals("{\"max_versions\":3,\"cas_required\":false}", secret.body().toString());
    assertEquals(URI.create(ADDRESS + "/v1/secret/metadata/app/db"), secret.uri());
  }

  @Test
  @DisplayName("listing and metadata share the metadata namespace")
  void metadataNamespace() {
    assertEquals(
        URI.create(ADDRESS + "/v1/secret/metadata/app/db?list=true"),
        VaultRequests.listSecrets(connection, PATH).uri());
    assertEquals(
        URI.create(ADDRESS + "/v1/secret/metadata/app/db"),
        VaultRequests.readMetadata(connection, PATH).uri());
    assertEquals("DELETE", VaultRequests.destroySecret(connection, PATH).method());
  }

  @Test
  @DisplayName("path segments are percent-encoded")
  void pathEncoding() {
    assertEquals("my%20app/db%3F/", VaultRequests.encodePath("my app/db?/"));
  }

  @Test
  @DisplayName("toString never prints the token")
  void toStringHidesToken() {
    final var request = VaultRequests.readSecret(connection, PATH, null);

    assertFalse(request.toString().contains(TOKEN));
    assertEquals("GET " + ADDRESS + "/v1/secret/data/app/db", request.toString());
  }
}
