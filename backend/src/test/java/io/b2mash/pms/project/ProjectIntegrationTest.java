package io.b2mash.pms.project;

import static io.b2mash.pms.testutil.TestUsers.jwtFor;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.jayway.jsonpath.JsonPath;
import io.b2mash.pms.TestcontainersConfiguration;
import io.b2mash.pms.security.Role;
import io.b2mash.pms.testutil.TestUsers;
import io.b2mash.pms.user.User;
import io.b2mash.pms.user.UserRepository;
import java.time.LocalDate;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.testcontainers.junit.jupiter.Testcontainers;

@SpringBootTest
@AutoConfigureMockMvc
@Import(TestcontainersConfiguration.class)
@ActiveProfiles("test")
@Testcontainers(disabledWithoutDocker = true)
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class ProjectIntegrationTest {

  @Autowired private MockMvc mockMvc;
  @Autowired private UserRepository userRepository;
  @Autowired private PasswordEncoder passwordEncoder;

  private User owner;
  private User otherUser;
  private User madmin;
  private User admin;
  private User staff;

  @BeforeAll
  void setup() {
    owner = TestUsers.approved(userRepository, passwordEncoder, "proj_owner", Role.USER);
    otherUser = TestUsers.approved(userRepository, passwordEncoder, "proj_other", Role.USER);
    madmin = TestUsers.approved(userRepository, passwordEncoder, "proj_madmin", Role.MADMIN);
    admin = TestUsers.approved(userRepository, passwordEncoder, "proj_admin", Role.ADMIN);
    staff = TestUsers.approved(userRepository, passwordEncoder, "proj_staff");
  }

  private String createProject(User creator, String name) throws Exception {
    var result =
        mockMvc
            .perform(
                post("/api/projects")
                    .with(jwtFor(creator))
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(
                        """
                        {"name": "%s", "description": "Test project", "startDate": "2024-05-01"}
                        """
                            .formatted(name)))
            .andExpect(status().isCreated())
            .andReturn();
    return JsonPath.read(result.getResponse().getContentAsString(), "$.id");
  }

  @Test
  void creatorReadsOwnProjectWithName() throws Exception {
    String id = createProject(owner, "Own Project");

    mockMvc
        .perform(get("/api/projects/" + id).with(jwtFor(owner)))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("pending"))
        .andExpect(jsonPath("$.createdBy").value(owner.getId().toString()))
        .andExpect(jsonPath("$.createdByName").value(owner.getName()));
  }

  @Test
  void nonOwnerIsForbiddenWithNotOwnerReason() throws Exception {
    String id = createProject(owner, "Private Project");

    mockMvc
        .perform(get("/api/projects/" + id).with(jwtFor(otherUser)))
        .andExpect(status().isForbidden())
        .andExpect(jsonPath("$.reason").value("not_owner"));

    mockMvc
        .perform(
            put("/api/projects/" + id)
                .with(jwtFor(otherUser))
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"name\": \"Hijacked\"}"))
        .andExpect(status().isForbidden())
        .andExpect(jsonPath("$.reason").value("not_owner"));
  }

  @Test
  void madminBypassesOwnership() throws Exception {
    String id = createProject(owner, "Visible To Madmin");

    mockMvc
        .perform(get("/api/projects/" + id).with(jwtFor(madmin)))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.name").value("Visible To Madmin"));
  }

  @Test
  void staffOnlyUserHasNoProjectAccess() throws Exception {
    mockMvc
        .perform(get("/api/projects").with(jwtFor(staff)))
        .andExpect(status().isForbidden())
        .andExpect(jsonPath("$.reason").value("insufficient_role"));
  }

  @Test
  void endDateBeforeStartDateIsRejected() throws Exception {
    mockMvc
        .perform(
            post("/api/projects")
                .with(jwtFor(madmin))
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"name": "Backwards", "startDate": "2024-05-10", "endDate": "2024-05-01",
                     "status": "completed"}
                    """))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.field").value("endDate"))
        .andExpect(jsonPath("$.constraint").value("date_order"));
  }

  @Test
  void missingNameIsRejected() throws Exception {
    mockMvc
        .perform(
            post("/api/projects")
                .with(jwtFor(owner))
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"startDate\": \"2024-05-10\"}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.errors[0].field").value("name"));
  }

  @Test
  void completingTwiceIsAConflict() throws Exception {
    String id = createProject(owner, "Finish Me");

    mockMvc
        .perform(put("/api/projects/" + id + "/complete").with(jwtFor(owner)))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("completed"))
        .andExpect(jsonPath("$.endDate").value(LocalDate.now().toString()));

    mockMvc
        .perform(put("/api/projects/" + id + "/complete").with(jwtFor(owner)))
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.condition").value("already_completed"));
  }

  @Test
  void listIsScopedToCreatorForPlainUsers() throws Exception {
    createProject(otherUser, "Other Users Project");
    var lister = TestUsers.approved(userRepository, passwordEncoder, "proj_lister", Role.USER);
    createProject(lister, "Lister Project");

    mockMvc
        .perform(get("/api/projects").with(jwtFor(lister)))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.pagination.total").value(1))
        .andExpect(jsonPath("$.items[0].name").value("Lister Project"));
  }

  @Test
  void plainUserFilteringOnAnotherCreatorSeesNothing() throws Exception {
    createProject(otherUser, "Not Yours");
    var lister = TestUsers.approved(userRepository, passwordEncoder, "proj_filter", Role.USER);
    createProject(lister, "Mine");

    mockMvc
        .perform(
            get("/api/projects")
                .param("userId", otherUser.getId().toString())
                .with(jwtFor(lister)))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.pagination.total").value(0))
        .andExpect(jsonPath("$.items").isEmpty());

    mockMvc
        .perform(
            get("/api/projects")
                .param("userId", otherUser.getId().toString())
                .with(jwtFor(madmin)))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.items[0].createdBy").value(otherUser.getId().toString()));
  }

  @Test
  void onlyAdminDeletesProjects() throws Exception {
    String id = createProject(owner, "Delete Me");

    mockMvc
        .perform(delete("/api/projects/" + id).with(jwtFor(madmin)))
        .andExpect(status().isForbidden());

    mockMvc
        .perform(delete("/api/projects/" + id).with(jwtFor(admin)))
        .andExpect(status().isNoContent());

    mockMvc
        .perform(get("/api/projects/" + id).with(jwtFor(admin)))
        .andExpect(status().isNotFound());
  }

  @Test
  void statsForUserWithoutProjectsAreZero() throws Exception {
    var fresh = TestUsers.approved(userRepository, passwordEncoder, "proj_fresh", Role.USER);

    mockMvc
        .perform(get("/api/projects/stats/overview").with(jwtFor(fresh)))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.total").value(0))
        .andExpect(jsonPath("$.completed").value(0))
        .andExpect(jsonPath("$.completionRate").value(0));
  }
}
