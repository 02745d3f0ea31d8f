package com.wpanther.licensing.integration;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.wpanther.licensing.dto.AssignRoleRequest;
import com.wpanther.licensing.dto.CreateCompanyRequest;
import com.wpanther.licensing.dto.CreateTenantRequest;
import com.wpanther.licensing.dto.LoginRequest;
import com.wpanther.licensing.dto.RegisterUserRequest;
import com.wpanther.licensing.dto.SignupRequest;
import com.wpanther.licensing.entity.LicenseFeatures;
import com.wpanther.licensing.repository.UserAccountRepository;
import org.junit.jupiter.api.MethodOrderer;
import org.junit.jupiter.api.Order;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestMethodOrder;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.request.MockHttpServletRequestBuilder;
import org.springframework.test.web.servlet.request.MockMvcRequestBuilders;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * End-to-end flow over the HTTP API: super user bootstrap, signup, per-request permission
 * resolution and the license lifecycle as seen by a company's users.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@TestMethodOrder(MethodOrderer.OrderAnnotation.class)
class TenantLicensingFlowTests {

        private static final String SUPER_USER_EMAIL = "root@platform.system";
        private static final String SUPER_USER_PASSWORD = "RootPassword123!";
        private static final String PASSWORD = "Secret123!";

        @Autowired
        private MockMvc mockMvc;

        @Autowired
        private ObjectMapper objectMapper;

        @Autowired
        private UserAccountRepository userAccountRepository;

        // Shared across the ordered steps
        private static String superUserToken;
        private static String adminToken;
        private static String memberToken;
        private static String memberId;
        private static String companyId;
        private static String licenseId;
        private static String viewerRoleId;

        @Test
        @Order(1)
        void testSuperUserIsBootstrapped() throws Exception {
                assertTrue(userAccountRepository.existsBySuperUserTrue());

                JsonNode response = postJson("/api/auth/login", new LoginRequest(SUPER_USER_EMAIL, SUPER_USER_PASSWORD), null, 200);
                superUserToken = response.get("token").asText();

                assertTrue(response.get("user").get("superUser").asBoolean());
        }

        @Test
        @Order(2)
        void testSuperUserCreatesCompany() throws Exception {
                CreateCompanyRequest request = CreateCompanyRequest.builder()
                                .name("Initech")
                                .domain("initech.test")
                                .features(LicenseFeatures.builder().maxUsers(5).maxTenants(1).build())
                                .expiresInDays(30)
                                .build();

                JsonNode response = postJson("/api/companies", request, superUserToken, 201);

                assertEquals("initech.test", response.get("company").get("domain").asText());
                assertEquals("active", response.get("company").get("licenseStatus").asText());
                assertEquals(4, response.get("licenseKey").asText().split("\\.").length);
        }

        @Test
        @Order(3)
        void testSignupCreatesOrganization() throws Exception {
                SignupRequest request = SignupRequest.builder()
                                .email("alice@globex.test")
                                .password(PASSWORD)
                                .fullName("Alice Admin")
                                .companyName("Globex")
                                .build();

                JsonNode response = postJson("/api/auth/signup", request, null, 201);
                companyId = response.get("companyId").asText();

                assertNotNull(response.get("licenseKey"));
                adminToken = login("alice@globex.test");
        }

        @Test
        @Order(4)
        void testSignupForTakenDomainPointsAtAdmin() throws Exception {
                SignupRequest request = SignupRequest.builder()
                                .email("bob@globex.test")
                                .password(PASSWORD)
                                .fullName("Bob")
                                .build();

                JsonNode response = postJson("/api/auth/signup", request, null, 200);

                assertTrue(response.get("domainExists").asBoolean());
                assertEquals("alice@globex.test", response.get("adminEmail").asText());
        }

        @Test
        @Order(5)
        void testCurrentContextOfOrganizationAdmin() throws Exception {
                mockMvc.perform(authorized(MockMvcRequestBuilders.get("/api/auth/me"), adminToken))
                                .andExpect(status().isOk())
                                .andExpect(jsonPath("$.companyId").value(companyId))
                                .andExpect(jsonPath("$.licenseStatus").value("active"))
                                .andExpect(jsonPath("$.roles[0]").value("Admin"))
                                .andExpect(jsonPath("$.user.orgAdmin").value(true));
        }

        @Test
        @Order(6)
        void testMissingOrInvalidTokenIsUnauthenticated() throws Exception {
                mockMvc.perform(MockMvcRequestBuilders.get("/api/roles"))
                                .andExpect(status().isUnauthorized())
                                .andExpect(jsonPath("$.message").value("Missing or malformed bearer token"));

                mockMvc.perform(authorized(MockMvcRequestBuilders.get("/api/roles"), "not-a-token"))
                                .andExpect(status().isUnauthorized())
                                .andExpect(jsonPath("$.message").value("Invalid or expired token"));
        }

        @Test
        @Order(7)
        void testLicenseAdministrationIsReservedToSuperUser() throws Exception {
                mockMvc.perform(authorized(MockMvcRequestBuilders.get("/api/licenses"), adminToken))
                                .andExpect(status().isForbidden())
                                .andExpect(jsonPath("$.message").value("Super user access required"));
        }

        @Test
        @Order(8)
        void testAdminSeesDefaultRolesAndCreatesTenant() throws Exception {
                MvcResult result = mockMvc.perform(authorized(MockMvcRequestBuilders.get("/api/roles"), adminToken))
                                .andExpect(status().isOk())
                                .andReturn();
                JsonNode roles = objectMapper.readTree(result.getResponse().getContentAsString());

                assertEquals(3, roles.size());
                for (JsonNode role : roles) {
                        if ("Viewer".equals(role.get("name").asText())) {
                                viewerRoleId = role.get("id").asText();
                        }
                }
                assertNotNull(viewerRoleId);

                CreateTenantRequest tenant = CreateTenantRequest.builder().name("Globex East").subdomain("globex-east").build();
                JsonNode created = postJson("/api/tenants", tenant, adminToken, 201);
                assertEquals(companyId, created.get("parentCompanyId").asText());
        }

        @Test
        @Order(9)
        void testPermissionsAreResolvedPerRequest() throws Exception {
                RegisterUserRequest request = RegisterUserRequest.builder()
                                .email("carol@globex.test")
                                .password(PASSWORD)
                                .fullName("Carol")
                                .build();
                memberId = postJson("/api/users", request, adminToken, 201).get("id").asText();
                memberToken = login("carol@globex.test");

                mockMvc.perform(authorized(MockMvcRequestBuilders.get("/api/roles"), memberToken))
                                .andExpect(status().isForbidden())
                                .andExpect(jsonPath("$.message").value("Insufficient permissions: requires 'role.read'"));

                postJson("/api/users/" + memberId + "/roles", new AssignRoleRequest(viewerRoleId), adminToken, 201);

                // Same token as before the assignment
                mockMvc.perform(authorized(MockMvcRequestBuilders.get("/api/roles"), memberToken))
                                .andExpect(status().isOk());
                mockMvc.perform(authorized(MockMvcRequestBuilders.post("/api/tenants")
                                                .contentType(MediaType.APPLICATION_JSON)
                                                .content(objectMapper.writeValueAsString(
                                                                CreateTenantRequest.builder().name("Nope").build())), memberToken))
                                .andExpect(status().isForbidden())
                                .andExpect(jsonPath("$.message").value("Organization admin access required"));
        }

        @Test
        @Order(10)
        void testDuplicateRoleAssignmentIsConflict() throws Exception {
                JsonNode response = postJson("/api/users/" + memberId + "/roles", new AssignRoleRequest(viewerRoleId), adminToken, 409);

                assertEquals("Role already assigned to user", response.get("message").asText());
        }

        @Test
        @Order(11)
        void testSuspendedLicenseLocksOrganizationOut() throws Exception {
                MvcResult result = mockMvc.perform(authorized(
                                                MockMvcRequestBuilders.get("/api/licenses/company/" + companyId), superUserToken))
                                .andExpect(status().isOk())
                                .andReturn();
                licenseId = objectMapper.readTree(result.getResponse().getContentAsString()).get("id").asText();

                JsonNode suspended = postJson("/api/licenses/" + licenseId + "/suspend", null, superUserToken, 200);
                assertEquals("suspended", suspended.get("status").asText());

                mockMvc.perform(authorized(MockMvcRequestBuilders.get("/api/auth/me"), adminToken))
                                .andExpect(status().isForbidden())
                                .andExpect(jsonPath("$.message").value("Invalid or expired license"))
                                .andExpect(jsonPath("$.reason").value("License is suspended"));

                // The super user is not bound by any license
                mockMvc.perform(authorized(MockMvcRequestBuilders.get("/api/auth/me"), superUserToken))
                                .andExpect(status().isOk());
        }

        @Test
        @Order(12)
        void testReactivatedLicenseRestoresAccess() throws Exception {
                JsonNode reactivated = postJson("/api/licenses/" + licenseId + "/reactivate", null, superUserToken, 200);
                assertEquals("active", reactivated.get("status").asText());

                mockMvc.perform(authorized(MockMvcRequestBuilders.get("/api/auth/me"), adminToken))
                                .andExpect(status().isOk());

                JsonNode validation = postJson("/api/licenses/" + licenseId + "/validate", null, superUserToken, 200);
                assertTrue(validation.get("valid").asBoolean());
        }

        @Test
        @Order(13)
        void testRevokedLicenseIsTerminal() throws Exception {
                JsonNode revoked = postJson("/api/licenses/" + licenseId + "/revoke", null, superUserToken, 200);
                assertEquals("revoked", revoked.get("status").asText());
                assertNotNull(revoked.get("revokedAt"));

                // Repeating a transition is a no-op
                postJson("/api/licenses/" + licenseId + "/revoke", null, superUserToken, 200);
                postJson("/api/licenses/" + licenseId + "/suspend", null, superUserToken, 409);

                mockMvc.perform(authorized(MockMvcRequestBuilders.get("/api/roles"), memberToken))
                                .andExpect(status().isForbidden())
                                .andExpect(jsonPath("$.reason").value("License has been revoked"));

                JsonNode validation = postJson("/api/licenses/" + licenseId + "/validate", null, superUserToken, 200);
                assertFalse(validation.get("valid").asBoolean());
                assertEquals("License has been revoked", validation.get("reason").asText());
        }

        @Test
        @Order(14)
        void testValidationErrorsAreReported() throws Exception {
                JsonNode response = postJson("/api/auth/signup", SignupRequest.builder()
                                .email("not-an-email")
                                .password("short")
                                .build(), null, 400);

                assertEquals("Validation failed", response.get("message").asText());
                assertTrue(response.get("errors").has("password"));
                assertTrue(response.get("errors").has("fullName"));
        }

        private String login(String email) throws Exception {
                return postJson("/api/auth/login", new LoginRequest(email, PASSWORD), null, 200).get("token").asText();
        }

        private JsonNode postJson(String path, Object body, String token, int expectedStatus) throws Exception {
                MockHttpServletRequestBuilder request = MockMvcRequestBuilders.post(path)
                                .contentType(MediaType.APPLICATION_JSON);
                if (body != null) {
                        request.content(objectMapper.writeValueAsString(body));
                }
                MvcResult result = mockMvc.perform(authorized(request, token))
                                .andExpect(status().is(expectedStatus))
                                .andReturn();
                String content = result.getResponse().getContentAsString();
                return content.isEmpty() ? objectMapper.createObjectNode() : objectMapper.readTree(content);
        }

        private static MockHttpServletRequestBuilder authorized(MockHttpServletRequestBuilder request, String token) {
                if (token != null) {
                        request.header(HttpHeaders.AUTHORIZATION, "Bearer " + token);
                }
                return request;
        }
}
