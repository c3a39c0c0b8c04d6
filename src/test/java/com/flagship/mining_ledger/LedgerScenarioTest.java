package com.flagship.mining_ledger;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.mining_ledger.auth.dto.LoginRequest;
import com.flagship.mining_ledger.auth.dto.SignupRequest;
import com.flagship.mining_ledger.entitlement.dto.PurchaseRequest;
import com.flagship.mining_ledger.support.MutableClock;
import com.flagship.mining_ledger.support.TestClockConfig;
import com.flagship.mining_ledger.withdrawal.dto.WithdrawRequest;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.request.MockHttpServletRequestBuilder;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * End-to-end membership scenarios over HTTP: signup and login, referral
 * validation, entitlement lifecycle with a controllable clock, withdrawals and
 * the concurrency guarantees of the per-account lock.
 */
@SpringBootTest
@AutoConfigureMockMvc
@Testcontainers
@Import(TestClockConfig.class)
class LedgerScenarioTest {

    private static final String PASSWORD = "correct-horse";
    private static final String PROOF = "0xabcdef0123456789";

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("mining_ledger_test")
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
        // No broker in these tests; events stay in the outbox
        registry.add("spring.kafka.bootstrap-servers", () -> "localhost:9999");
        registry.add("spring.kafka.admin.auto-create", () -> "false");
        registry.add("outbox.publisher.enabled", () -> "false");
    }

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private MutableClock clock;

    // ========================================================================
    // HELPER METHODS
    // ========================================================================

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("SCENARIO: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printSuccess(String message) {
        System.out.println("✓ VERIFIED: " + message);
    }

    private static String uniqueName(String prefix) {
        return prefix + "-" + UUID.randomUUID().toString().substring(0, 8);
    }

    private JsonNode read(MvcResult result) throws Exception {
        return objectMapper.readTree(result.getResponse().getContentAsString());
    }

    private static BigDecimal decimal(JsonNode node) {
        return new BigDecimal(node.asText());
    }

    private static MockHttpServletRequestBuilder authorized(MockHttpServletRequestBuilder request, String token) {
        return request.header(HttpHeaders.AUTHORIZATION, "Bearer " + token);
    }

    private JsonNode signup(String username, String referCode) throws Exception {
        MvcResult result = mockMvc.perform(post("/api/auth/signup")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new SignupRequest(username, PASSWORD, referCode))))
                .andExpect(status().isCreated())
                .andReturn();
        return read(result);
    }

    private String login(String username) throws Exception {
        MvcResult result = mockMvc.perform(post("/api/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new LoginRequest(username, PASSWORD))))
                .andExpect(status().isOk())
                .andReturn();
        return read(result).get("token").asText();
    }

    private JsonNode profile(String token) throws Exception {
        return read(mockMvc.perform(authorized(get("/api/user/profile"), token))
                .andExpect(status().isOk())
                .andReturn());
    }

    private MvcResult purchase(String token, String nodeId) throws Exception {
        return mockMvc.perform(authorized(post("/api/nodes/purchase"), token)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new PurchaseRequest(nodeId, PROOF))))
                .andReturn();
    }

    private MvcResult withdraw(String token, String balanceType, String amount, String idempotencyKey)
            throws Exception {
        MockHttpServletRequestBuilder request = authorized(post("/api/withdraw"), token)
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(new WithdrawRequest(balanceType, new BigDecimal(amount))));
        if (idempotencyKey != null) {
            request.header("Idempotency-Key", idempotencyKey);
        }
        return mockMvc.perform(request).andReturn();
    }

    /**
     * Signs up, buys the given tier and lets it mature. Returns a fresh token,
     * since advancing the clock past the token lifetime expires the old one.
     */
    private String accountWithMaturedTier(String username, String nodeId, Duration duration) throws Exception {
        String token = signup(username, null).get("token").asText();
        assertEquals(201, purchase(token, nodeId).getResponse().getStatus());
        clock.advance(duration);
        return login(username);
    }

    // ========================================================================
    // SIGNUP AND LOGIN
    // ========================================================================

    @Nested
    @DisplayName("1. Signup and login")
    class SignupAndLogin {

        @Test
        @DisplayName("1.1 Signup credits the bonus and returns a usable token")
        void signup_CreditsBonus() throws Exception {
            printTestHeader("Signup bonus");
            String username = uniqueName("alice");

            JsonNode response = signup(username, null);

            assertTrue(response.get("success").asBoolean());
            JsonNode user = response.get("user");
            assertEquals(username, user.get("username").asText());
            assertEquals(0, decimal(user.get("mine_balance")).compareTo(new BigDecimal("25")));
            assertEquals(0, decimal(user.get("referral_balance")).compareTo(BigDecimal.ZERO));
            assertFalse(user.get("has_purchased_node").asBoolean());
            assertFalse(user.get("has_purchased_node4").asBoolean());

            JsonNode profile = profile(response.get("token").asText());
            assertEquals(user.get("refer_code").asText(), profile.get("refer_code").asText());

            printSuccess("New account holds exactly the signup bonus");
        }

        @Test
        @DisplayName("1.2 Duplicate username is rejected with 409")
        void signup_DuplicateUsername() throws Exception {
            String username = uniqueName("dup");
            signup(username, null);

            mockMvc.perform(post("/api/auth/signup")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(objectMapper.writeValueAsString(new SignupRequest(username, PASSWORD, null))))
                    .andExpect(status().isConflict())
                    .andExpect(jsonPath("$.error").value("DUPLICATE_ACCOUNT"));
        }

        @Test
        @DisplayName("1.3 Unknown referral code fails signup and leaves no account")
        void signup_InvalidReferralCode() throws Exception {
            String username = uniqueName("ghost");

            mockMvc.perform(post("/api/auth/signup")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(objectMapper.writeValueAsString(new SignupRequest(username, PASSWORD, "NOPE0000"))))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.error").value("INVALID_REFERRAL_CODE"));

            mockMvc.perform(post("/api/auth/login")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(objectMapper.writeValueAsString(new LoginRequest(username, PASSWORD))))
                    .andExpect(status().isUnauthorized());

            printSuccess("Signup rolled back as a whole");
        }

        @Test
        @DisplayName("1.4 Wrong password and missing token both yield 401")
        void login_Rejections() throws Exception {
            String username = uniqueName("bob");
            signup(username, null);

            mockMvc.perform(post("/api/auth/login")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(objectMapper.writeValueAsString(new LoginRequest(username, "wrong-password"))))
                    .andExpect(status().isUnauthorized())
                    .andExpect(jsonPath("$.error").value("INVALID_CREDENTIALS"));

            mockMvc.perform(get("/api/user/profile"))
                    .andExpect(status().isUnauthorized())
                    .andExpect(jsonPath("$.error").value("UNAUTHORIZED"));

            mockMvc.perform(authorized(get("/api/user/profile"), "not-a-jwt"))
                    .andExpect(status().isUnauthorized())
                    .andExpect(jsonPath("$.message").value("Invalid token"));
        }

        @Test
        @DisplayName("1.5 Catalog is public")
        void catalog_Public() throws Exception {
            mockMvc.perform(get("/api/config"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.top_tier").value("node4"))
                    .andExpect(jsonPath("$.nodes.length()").value(4));
        }
    }

    // ========================================================================
    // REFERRALS
    // ========================================================================

    @Nested
    @DisplayName("2. Referrals")
    class Referrals {

        @Test
        @DisplayName("2.1 Referrer is credited once, on the referred account's first purchase")
        void referral_CreditedOnce() throws Exception {
            printTestHeader("Referral validation");
            JsonNode alice = signup(uniqueName("alice"), null);
            String aliceToken = alice.get("token").asText();
            String code = alice.get("user").get("refer_code").asText();

            String bobToken = signup(uniqueName("bob"), code.toLowerCase()).get("token").asText();

            JsonNode before = read(mockMvc.perform(authorized(get("/api/referrals"), aliceToken))
                    .andExpect(status().isOk()).andReturn());
            assertEquals(0, before.get("valid_referrals").size());
            assertEquals(1, before.get("invalid_referrals").size());
            assertFalse(before.get("invalid_referrals").get(0).get("is_valid").asBoolean());

            assertEquals(201, purchase(bobToken, "node1").getResponse().getStatus());
            assertEquals(201, purchase(bobToken, "node2").getResponse().getStatus());

            JsonNode aliceProfile = profile(aliceToken);
            assertEquals(0, decimal(aliceProfile.get("referral_balance")).compareTo(new BigDecimal("50")));

            JsonNode after = read(mockMvc.perform(authorized(get("/api/referrals"), aliceToken))
                    .andExpect(status().isOk()).andReturn());
            assertEquals(1, after.get("valid_referrals").size());
            assertEquals(0, after.get("invalid_referrals").size());
            assertEquals(0, decimal(after.get("total_earned")).compareTo(new BigDecimal("50")));

            printSuccess("Second purchase did not credit the referrer again");
        }

        @Test
        @DisplayName("2.2 Concurrent first purchases credit the referrer exactly once")
        void referral_ConcurrentFirstPurchases() throws Exception {
            printTestHeader("Concurrent first purchases");
            JsonNode alice = signup(uniqueName("alice"), null);
            String aliceToken = alice.get("token").asText();
            String bobToken = signup(uniqueName("bob"), alice.get("user").get("refer_code").asText())
                    .get("token").asText();

            List<String> tiers = List.of("node1", "node2", "node3", "node4");
            ExecutorService executor = Executors.newFixedThreadPool(tiers.size());
            CountDownLatch start = new CountDownLatch(1);
            List<Future<Integer>> results = new ArrayList<>();
            for (String tier : tiers) {
                results.add(executor.submit(() -> {
                    start.await();
                    return purchase(bobToken, tier).getResponse().getStatus();
                }));
            }
            start.countDown();
            for (Future<Integer> result : results) {
                assertEquals(201, result.get(30, TimeUnit.SECONDS));
            }
            executor.shutdown();

            JsonNode aliceProfile = profile(aliceToken);
            assertEquals(0, decimal(aliceProfile.get("referral_balance")).compareTo(new BigDecimal("50")));

            printSuccess("Referral reward credited once under concurrency");
        }
    }

    // ========================================================================
    // ENTITLEMENTS
    // ========================================================================

    @Nested
    @DisplayName("3. Entitlement lifecycle")
    class Entitlements {

        @Test
        @DisplayName("3.1 Active tier cannot be bought again until it matures and pays out")
        void entitlement_MatureAndRebuy() throws Exception {
            printTestHeader("Entitlement lifecycle");
            String username = uniqueName("carol");
            String token = signup(username, null).get("token").asText();

            MvcResult first = purchase(token, "node1");
            assertEquals(201, first.getResponse().getStatus());
            assertEquals("node1", read(first).get("node_id").asText());

            MvcResult duplicate = purchase(token, "node1");
            assertEquals(409, duplicate.getResponse().getStatus());
            assertEquals("DUPLICATE_ACTIVE_ENTITLEMENT", read(duplicate).get("error").asText());

            mockMvc.perform(authorized(get("/api/nodes"), token))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.nodes.node1.owned").value(true))
                    .andExpect(jsonPath("$.nodes.node1.can_rebuy").value(false))
                    .andExpect(jsonPath("$.nodes.node2.owned").value(false));

            clock.advance(Duration.ofDays(30));
            String fresh = login(username);

            JsonNode profile = profile(fresh);
            assertEquals(0, decimal(profile.get("mine_balance")).compareTo(new BigDecimal("525")));
            assertTrue(profile.get("has_purchased_node").asBoolean());

            mockMvc.perform(authorized(get("/api/nodes"), fresh))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.nodes.node1.active").value(false))
                    .andExpect(jsonPath("$.nodes.node1.can_rebuy").value(true));

            assertEquals(201, purchase(fresh, "node1").getResponse().getStatus());
            // a second status read must not pay the completed instance again
            assertEquals(0, decimal(profile(fresh).get("mine_balance")).compareTo(new BigDecimal("525")));

            printSuccess("Payout credited exactly once; tier purchasable again after maturity");
        }

        @Test
        @DisplayName("3.2 Unknown tier and short payment proof are rejected")
        void entitlement_Rejections() throws Exception {
            String token = signup(uniqueName("dave"), null).get("token").asText();

            MvcResult unknown = purchase(token, "node9");
            assertEquals(400, unknown.getResponse().getStatus());
            assertEquals("UNKNOWN_TIER", read(unknown).get("error").asText());

            mockMvc.perform(authorized(post("/api/nodes/purchase"), token)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(objectMapper.writeValueAsString(new PurchaseRequest("node1", "0x123"))))
                    .andExpect(status().isUnprocessableEntity())
                    .andExpect(jsonPath("$.error").value("PAYMENT_UNVERIFIED"));

            assertFalse(profile(token).get("has_purchased_node").asBoolean());
        }
    }

    // ========================================================================
    // WITHDRAWALS
    // ========================================================================

    @Nested
    @DisplayName("4. Withdrawals")
    class Withdrawals {

        @Test
        @DisplayName("4.1 Mine balance needs any purchase; referral balance needs the top tier")
        void withdraw_EligibilityGates() throws Exception {
            printTestHeader("Withdrawal eligibility");
            JsonNode alice = signup(uniqueName("alice"), null);
            String aliceToken = alice.get("token").asText();
            String bobToken = signup(uniqueName("bob"), alice.get("user").get("refer_code").asText())
                    .get("token").asText();

            MvcResult mineBlocked = withdraw(aliceToken, "mine", "25", null);
            assertEquals(403, mineBlocked.getResponse().getStatus());
            assertEquals("NOT_ELIGIBLE", read(mineBlocked).get("error").asText());

            assertEquals(201, purchase(bobToken, "node1").getResponse().getStatus());
            assertEquals(201, purchase(aliceToken, "node1").getResponse().getStatus());

            MvcResult referralBlocked = withdraw(aliceToken, "referral", "50", null);
            assertEquals(403, referralBlocked.getResponse().getStatus());

            assertEquals(201, purchase(aliceToken, "node4").getResponse().getStatus());
            MvcResult referralOk = withdraw(aliceToken, "referral", "50", null);
            assertEquals(201, referralOk.getResponse().getStatus());
            assertEquals(0, decimal(read(referralOk).get("remaining_balance")).compareTo(BigDecimal.ZERO));

            MvcResult mineOk = withdraw(aliceToken, "mine", "25", null);
            assertEquals(201, mineOk.getResponse().getStatus());

            printSuccess("Flags gate each balance independently");
        }

        @Test
        @DisplayName("4.2 Minimums, unknown types and overdrafts are rejected")
        void withdraw_Rejections() throws Exception {
            String token = accountWithMaturedTier(uniqueName("erin"), "node4", Duration.ofDays(3));

            MvcResult belowMinimum = withdraw(token, "mine", "24", null);
            assertEquals(422, belowMinimum.getResponse().getStatus());
            assertEquals("BELOW_MINIMUM", read(belowMinimum).get("error").asText());

            MvcResult unknownType = withdraw(token, "savings", "100", null);
            assertEquals(400, unknownType.getResponse().getStatus());
            assertEquals("UNKNOWN_BALANCE_TYPE", read(unknownType).get("error").asText());

            MvcResult overdraft = withdraw(token, "mine", "1025.01", null);
            assertEquals(422, overdraft.getResponse().getStatus());
            assertEquals("INSUFFICIENT_FUNDS", read(overdraft).get("error").asText());

            assertEquals(0, decimal(profile(token).get("mine_balance")).compareTo(new BigDecimal("1025")));
        }

        @Test
        @DisplayName("4.3 Repeated Idempotency-Key debits once and replays the original withdrawal")
        void withdraw_Idempotent() throws Exception {
            printTestHeader("Withdrawal idempotency");
            String token = accountWithMaturedTier(uniqueName("frank"), "node4", Duration.ofDays(3));
            String key = "withdraw-" + UUID.randomUUID();

            MvcResult first = withdraw(token, "mine", "100", key);
            MvcResult second = withdraw(token, "mine", "100", key);

            assertEquals(201, first.getResponse().getStatus());
            assertEquals(200, second.getResponse().getStatus());
            assertEquals(read(first).get("withdrawal").get("id").asText(),
                    read(second).get("withdrawal").get("id").asText());
            assertEquals(0, decimal(profile(token).get("mine_balance")).compareTo(new BigDecimal("925")));

            JsonNode history = read(mockMvc.perform(authorized(get("/api/withdrawals"), token))
                    .andExpect(status().isOk()).andReturn());
            assertEquals(1, history.size());

            printSuccess("Second request replayed without a second debit");
        }

        @Test
        @DisplayName("4.4 Concurrent withdrawals never overdraw the balance")
        void withdraw_ConcurrentNeverNegative() throws Exception {
            printTestHeader("Concurrent withdrawals");
            String token = accountWithMaturedTier(uniqueName("grace"), "node4", Duration.ofDays(3));

            int threads = 15;
            ExecutorService executor = Executors.newFixedThreadPool(threads);
            CountDownLatch start = new CountDownLatch(1);
            List<Future<Integer>> results = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                results.add(executor.submit(() -> {
                    start.await();
                    return withdraw(token, "mine", "100", null).getResponse().getStatus();
                }));
            }
            start.countDown();

            int succeeded = 0;
            int insufficient = 0;
            for (Future<Integer> result : results) {
                int statusCode = result.get(60, TimeUnit.SECONDS);
                if (statusCode == 201) {
                    succeeded++;
                } else if (statusCode == 422) {
                    insufficient++;
                }
            }
            executor.shutdown();

            System.out.println("Succeeded: " + succeeded + ", insufficient: " + insufficient);
            assertEquals(10, succeeded);
            assertEquals(5, insufficient);
            assertEquals(0, decimal(profile(token).get("mine_balance")).compareTo(new BigDecimal("25")));

            printSuccess("Exactly the affordable withdrawals went through");
        }
    }
}
