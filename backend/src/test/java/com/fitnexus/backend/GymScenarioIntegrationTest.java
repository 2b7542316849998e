package com.fitnexus.backend;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fitnexus.backend.modules.account.domain.GymRole;
import com.fitnexus.backend.support.AbstractPostgresIntegrationTest;
import com.fitnexus.backend.support.TestUserFactory;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.ResultActions;

@SpringBootTest
@AutoConfigureMockMvc
@Import(TestUserFactory.class)
class GymScenarioIntegrationTest extends AbstractPostgresIntegrationTest {

    private static final String PUNE = "Pune Branch";
    private static final String MUMBAI = "Mumbai Branch";
    private static final String PASSWORD = "password123";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private TestUserFactory testUserFactory;

    private String superadminToken;
    private String puneAdminToken;

    @BeforeEach
    void setUp() throws Exception {
        testUserFactory.createAccount("root@fitnexus.test", PASSWORD, GymRole.SUPERADMIN, null);
        testUserFactory.createAccount("pune-admin@fitnexus.test", PASSWORD, GymRole.ADMIN, PUNE);
        superadminToken = login("root@fitnexus.test");
        puneAdminToken = login("pune-admin@fitnexus.test");
    }

    @Test
    void trainerSessionBookingAndPlanScenario() throws Exception {
        String memberId = register("Meera", "meera@fitnexus.test", PUNE);
        String outsiderId = register("Nikhil", "nikhil@fitnexus.test", MUMBAI);
        addTrainer(puneAdminToken, "Asha", "asha@fitnexus.test", null);

        String trainerToken = login("asha@fitnexus.test");
        String memberToken = login("meera@fitnexus.test");
        String outsiderToken = login("nikhil@fitnexus.test");

        JsonNode session = readJson(authorized(post("/trainers/sessions"), trainerToken, """
                {"sessionName": "Yoga", "sessionDate": "2024-06-01", "startTime": "07:00:00", "endTime": "08:00:00"}
                """)
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.branchName").value(PUNE))
                .andReturn());
        String sessionId = session.path("id").asText();
        String attendancePath = "/trainers/sessions/" + sessionId + "/attendance";

        JsonNode booked = readJson(authorized(post(attendancePath), memberToken, """
                {"userId": "%s", "status": "booked", "attendanceDate": "2024-06-01"}
                """.formatted(memberId))
                .andExpect(status().isCreated())
                .andReturn());

        authorized(post(attendancePath), memberToken, """
                {"userId": "%s", "status": "attended", "attendanceDate": "2024-06-01"}
                """.formatted(memberId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value(booked.path("id").asText()))
                .andExpect(jsonPath("$.status").value("attended"));

        mockMvc.perform(get(attendancePath).header("Authorization", "Bearer " + trainerToken))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(1))
                .andExpect(jsonPath("$[0].status").value("attended"));

        authorized(post(attendancePath), outsiderToken, """
                {"userId": "%s", "status": "booked", "attendanceDate": "2024-06-01"}
                """.formatted(outsiderId))
                .andExpect(status().isForbidden());

        authorized(post(attendancePath), outsiderToken, """
                {"userId": "%s", "status": "booked", "attendanceDate": "2024-06-01"}
                """.formatted(memberId))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("ATTENDANCE_SELF_ONLY"));

        authorized(post("/trainers/diet-plans"), trainerToken, """
                {"userId": "%s", "title": "Cutting"}
                """.formatted(outsiderId))
                .andExpect(status().isNotFound());

        JsonNode plan = readJson(authorized(post("/trainers/diet-plans"), trainerToken, """
                {"userId": "%s", "title": "Cutting", "description": "High protein"}
                """.formatted(memberId))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.user.id").value(memberId))
                .andReturn());

        authorized(put("/trainers/diet-plans/" + plan.path("id").asText()), trainerToken, """
                {"userId": "%s", "title": "Bulking"}
                """.formatted(outsiderId))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("IMMUTABLE_FIELD"));
    }

    @Test
    void trainerListingIsScopedByRole() throws Exception {
        addTrainer(puneAdminToken, "Asha", "asha@fitnexus.test", null);
        addTrainer(superadminToken, "Ravi", "ravi@fitnexus.test", MUMBAI);

        mockMvc.perform(get("/trainers").header("Authorization", "Bearer " + puneAdminToken))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(1))
                .andExpect(jsonPath("$[0].branchName").value(PUNE));

        mockMvc.perform(get("/trainers").header("Authorization", "Bearer " + superadminToken))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(2));
    }

    @Test
    void apiDocsDescribeEndpointsAndProblemCodes() throws Exception {
        mockMvc.perform(get("/v3/api-docs"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.paths['/trainers/sessions/{sessionId}/attendance'].post.summary")
                        .value("Book or mark attendance"))
                .andExpect(jsonPath("$.paths['/trainers/sessions/{sessionId}/attendance'].post.responses['409'].description")
                        .value("Session already full for that date, code `SESSION_FULL`"))
                .andExpect(jsonPath("$.paths['/trainers/add-trainer'].post.responses['409'].description")
                        .value("Email taken, code `EMAIL_ALREADY_REGISTERED`"))
                .andExpect(jsonPath("$.paths['/trainers/diet-plans'].post.summary").value("Assign a diet plan"));
    }

    @Test
    void anonymousRequestsAreRejected() throws Exception {
        mockMvc.perform(get("/trainers"))
                .andExpect(status().isUnauthorized());
        mockMvc.perform(get("/trainers").header("Authorization", "Bearer not-a-jwt"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("INVALID_ACCESS_TOKEN"));
    }

    private String register(String name, String email, String branch) throws Exception {
        MvcResult result = mockMvc.perform(post("/auth/register")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"name": "%s", "email": "%s", "password": "%s", "branch": "%s"}
                                """.formatted(name, email, PASSWORD, branch)))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.role").value("member"))
                .andReturn();
        return readJson(result).path("id").asText();
    }

    private void addTrainer(String token, String name, String email, String branch) throws Exception {
        String branchJson = branch == null ? "null" : "\"" + branch + "\"";
        authorized(post("/trainers/add-trainer"), token, """
                {"name": "%s", "email": "%s", "password": "%s", "specialization": ["Yoga"],
                 "rating": 4.5, "experience": 3, "branchName": %s}
                """.formatted(name, email, PASSWORD, branchJson))
                .andExpect(status().isCreated());
    }

    private String login(String email) throws Exception {
        MvcResult result = mockMvc.perform(post("/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"email": "%s", "password": "%s"}
                                """.formatted(email, PASSWORD)))
                .andExpect(status().isOk())
                .andReturn();
        String token = readJson(result).path("tokens").path("accessToken").asText();
        assertThat(token).isNotBlank();
        return token;
    }

    private ResultActions authorized(
            org.springframework.test.web.servlet.request.MockHttpServletRequestBuilder request,
            String token,
            String body
    ) throws Exception {
        return mockMvc.perform(request
                .header("Authorization", "Bearer " + token)
                .contentType(MediaType.APPLICATION_JSON)
                .content(body));
    }

    private JsonNode readJson(MvcResult result) throws Exception {
        return objectMapper.readTree(result.getResponse().getContentAsString());
    }
}
