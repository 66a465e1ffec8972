package com.caradonti.finance_ledger.register;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.http.MediaType;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * HTTP flow of the cash register API against Postgres and Redis.
 */
@SpringBootTest
@AutoConfigureMockMvc
@Testcontainers(disabledWithoutDocker = true)
class CashRegisterControllerTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("finance_ledger_test")
            .withUsername("test")
            .withPassword("test");

    @Container
    static GenericContainer<?> redis = new GenericContainer<>(DockerImageName.parse("redis:7-alpine"))
            .withExposedPorts(6379);

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.data.redis.host", redis::getHost);
        registry.add("spring.data.redis.port", () -> redis.getMappedPort(6379).toString());
        registry.add("spring.kafka.bootstrap-servers", () -> "localhost:9999");
        registry.add("spring.kafka.admin.auto-create", () -> "false");
        registry.add("consumer.enabled", () -> "false");
        registry.add("outbox.publisher.enabled", () -> "false");
    }

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private StringRedisTemplate redisTemplate;

    private String registerId;

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    @BeforeEach
    void setUp() throws Exception {
        try (RedisConnection connection = redisTemplate.getConnectionFactory().getConnection()) {
            connection.serverCommands().flushAll();
        }

        String body = objectMapper.writeValueAsString(Map.of("type", "GENERAL", "name", "Caja " + UUID.randomUUID()));
        String json = mockMvc.perform(post("/api/registers")
                .header("X-Actor-Id", "u-1")
                .header("X-Actor-Name", "Fede")
                .contentType(MediaType.APPLICATION_JSON)
                .content(body))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.created_by").value("Fede"))
            .andReturn().getResponse().getContentAsString();
        registerId = objectMapper.readTree(json).get("id").asText();
    }

    private String expenseBody(String ars) throws Exception {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("date", "2024-06-01");
        body.put("description", "Pago DJ");
        body.put("expense_ars", ars);
        return objectMapper.writeValueAsString(body);
    }

    @Test
    @DisplayName("Append returns 201 and a replay with the same key returns 200 with the same entry")
    void testAppend_IdempotentReplay() throws Exception {
        printTestHeader("Append Idempotency");

        String key = UUID.randomUUID().toString();
        String firstJson = mockMvc.perform(post("/api/registers/{id}/entries", registerId)
                .header("Idempotency-Key", key)
                .header("X-Actor-Id", "u-2")
                .header("X-Actor-Name", "Caro")
                .contentType(MediaType.APPLICATION_JSON)
                .content(expenseBody("15000")))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.entry.approval_status").value("PENDING"))
            .andExpect(jsonPath("$.entry.approval_requirement").value("SINGLE"))
            .andExpect(jsonPath("$.entry.created_by").value("Caro"))
            .andExpect(jsonPath("$.balance.total_expense.ars").value(15000.0))
            .andReturn().getResponse().getContentAsString();

        String secondJson = mockMvc.perform(post("/api/registers/{id}/entries", registerId)
                .header("Idempotency-Key", key)
                .contentType(MediaType.APPLICATION_JSON)
                .content(expenseBody("15000")))
            .andExpect(status().isOk())
            .andReturn().getResponse().getContentAsString();

        JsonNode first = objectMapper.readTree(firstJson);
        JsonNode second = objectMapper.readTree(secondJson);
        printOutput("First entry", first.get("entry").get("id").asText());
        printOutput("Replayed entry", second.get("entry").get("id").asText());
        assertEquals(first.get("entry").get("id").asText(), second.get("entry").get("id").asText());
        assertTrue(second.get("balance").isNull());

        mockMvc.perform(get("/api/registers/{id}/balance", registerId))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.entry_count").value(1));
        printSuccess("One entry created for two requests");
    }

    @Test
    @DisplayName("Append without an Idempotency-Key header is rejected")
    void testAppend_MissingIdempotencyKey() throws Exception {
        printTestHeader("Missing Idempotency Key");

        mockMvc.perform(post("/api/registers/{id}/entries", registerId)
                .contentType(MediaType.APPLICATION_JSON)
                .content(expenseBody("500")))
            .andExpect(status().isBadRequest());
        printSuccess("400 returned");
    }

    @Test
    @DisplayName("Negative amounts fail validation")
    void testAppend_NegativeAmount() throws Exception {
        printTestHeader("Negative Amount");

        mockMvc.perform(post("/api/registers/{id}/entries", registerId)
                .header("Idempotency-Key", UUID.randomUUID().toString())
                .contentType(MediaType.APPLICATION_JSON)
                .content(expenseBody("-10")))
            .andExpect(status().isBadRequest());
        printSuccess("400 returned");
    }

    @Test
    @DisplayName("Appending to an unknown register returns 404")
    void testAppend_UnknownRegister() throws Exception {
        printTestHeader("Unknown Register");

        mockMvc.perform(post("/api/registers/{id}/entries", UUID.randomUUID())
                .header("Idempotency-Key", UUID.randomUUID().toString())
                .contentType(MediaType.APPLICATION_JSON)
                .content(expenseBody("500")))
            .andExpect(status().isNotFound());
        printSuccess("404 returned");
    }

    @Test
    @DisplayName("Approving a pending entry records the approver and is a no-op when repeated")
    void testApprove_ThenRetry() throws Exception {
        printTestHeader("Approve And Retry");

        String json = mockMvc.perform(post("/api/registers/{id}/entries", registerId)
                .header("Idempotency-Key", UUID.randomUUID().toString())
                .contentType(MediaType.APPLICATION_JSON)
                .content(expenseBody("12000")))
            .andExpect(status().isCreated())
            .andReturn().getResponse().getContentAsString();
        String entryId = objectMapper.readTree(json).get("entry").get("id").asText();

        String approve = objectMapper.writeValueAsString(Map.of("role", "fede"));
        mockMvc.perform(post("/api/registers/{id}/entries/{entryId}/approvals", registerId, entryId)
                .header("X-Actor-Id", "u-1")
                .header("X-Actor-Name", "Fede")
                .contentType(MediaType.APPLICATION_JSON)
                .content(approve))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.changed").value(true))
            .andExpect(jsonPath("$.previous_status").value("PENDING"))
            .andExpect(jsonPath("$.entry.approval_status").value("APPROVED"))
            .andExpect(jsonPath("$.entry.approvals.fede.approved_by").value("Fede"));

        mockMvc.perform(post("/api/registers/{id}/entries/{entryId}/approvals", registerId, entryId)
                .contentType(MediaType.APPLICATION_JSON)
                .content(approve))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.changed").value(false));
        printSuccess("Second approval changed nothing");
    }

    @Test
    @DisplayName("Approving an entry that does not exist returns 404")
    void testApprove_UnknownEntry() throws Exception {
        printTestHeader("Approve Unknown Entry");

        UUID entryId = UUID.randomUUID();
        mockMvc.perform(post("/api/registers/{id}/entries/{entryId}/approvals", registerId, entryId)
                .header("X-Actor-Id", "u-1")
                .header("X-Actor-Name", "Fede")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(Map.of("role", "fede"))))
            .andExpect(status().isNotFound());

        mockMvc.perform(get("/api/registers/{id}/balance", registerId))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.entry_count").value(0));
        printOutput("Unknown entry", entryId);
        printSuccess("404 returned, register untouched");
    }

    @Test
    @DisplayName("Unknown approver roles are rejected")
    void testApprove_UnknownRole() throws Exception {
        printTestHeader("Unknown Approver Role");

        String json = mockMvc.perform(post("/api/registers/{id}/entries", registerId)
                .header("Idempotency-Key", UUID.randomUUID().toString())
                .contentType(MediaType.APPLICATION_JSON)
                .content(expenseBody("12000")))
            .andReturn().getResponse().getContentAsString();
        String entryId = objectMapper.readTree(json).get("entry").get("id").asText();

        mockMvc.perform(post("/api/registers/{id}/entries/{entryId}/approvals", registerId, entryId)
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(Map.of("role", "treasurer"))))
            .andExpect(status().isBadRequest());
        printSuccess("400 returned");
    }
}
