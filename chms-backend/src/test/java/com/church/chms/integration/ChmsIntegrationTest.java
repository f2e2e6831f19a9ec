package com.church.chms.integration;

import com.jayway.jsonpath.JsonPath;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.ResultActions;

import java.time.LocalDate;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.greaterThanOrEqualTo;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * 【集成测试】基于 H2 (MySQL 模式) 的端到端测试
 *
 * 测试范围：
 * - 成员注册、唯一性约束、分页总数
 * - 被引用时禁止删除 (家庭、小组、权限、已批准预算)
 * - 志愿者批量分配的整批回滚
 * - 奉献合计与财务报表
 * - 登录、令牌刷新与登出
 * - 支出审批流程与支出报表
 *
 * 各测试共享同一个内存库，所有名称带序号避免相互冲突。
 */
@Slf4j
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@DisplayName("教会管理系统集成测试")
class ChmsIntegrationTest {

    private static final AtomicInteger SEQ = new AtomicInteger();

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    private long registerMember(String firstName) throws Exception {
        int n = SEQ.incrementAndGet();
        String body = "{\"firstName\":\"" + firstName + "\",\"familyName\":\"Test" + n + "\","
                + "\"emailAddress\":\"user" + n + "@example.com\","
                + "\"username\":\"user" + n + "\",\"password\":\"password" + n + "\"}";
        MvcResult result = mockMvc.perform(post("/api/members")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isOk())
                .andReturn();
        return idOf(result);
    }

    /**
     * 用注册时的用户名密码登录，返回访问令牌
     */
    private String accessTokenFor(long memberId) throws Exception {
        String username = jdbcTemplate.queryForObject(
                "SELECT username FROM userauthentication WHERE mbr_id = ?", String.class, memberId);
        MvcResult result = login(username, username.replace("user", "password"))
                .andExpect(status().isOk())
                .andReturn();
        return JsonPath.read(result.getResponse().getContentAsString(), "$.data.accessToken");
    }

    private ResultActions login(String username, String password) throws Exception {
        return mockMvc.perform(post("/api/auth/login")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"username\":\"" + username + "\",\"password\":\"" + password + "\"}"));
    }

    private static long idOf(MvcResult result) throws Exception {
        Number id = JsonPath.read(result.getResponse().getContentAsString(), "$.data.id");
        return id.longValue();
    }

    @Test
    @DisplayName("T1: 成员注册与查询")
    void testRegisterAndGetMember() throws Exception {
        long memberId = registerMember("Akosua");

        mockMvc.perform(get("/api/members/{id}", memberId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value(200))
                .andExpect(jsonPath("$.data.firstName").value("Akosua"))
                .andExpect(jsonPath("$.data.gender").value("Male"))
                .andExpect(jsonPath("$.data.occupation").value("Not Applicable"))
                .andExpect(jsonPath("$.data.branchName").value("Main Branch"));

        Long roleId = jdbcTemplate.queryForObject(
                "SELECT role_id FROM memberrole WHERE mbr_id = ?", Long.class, memberId);
        assertThat(roleId).isEqualTo(6L);

        Long audits = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM audit_log WHERE entity_type = 'member' AND entity_id = ?", Long.class, memberId);
        assertThat(audits).isEqualTo(1L);
    }

    @Test
    @DisplayName("T2: 用户名唯一与请求校验")
    void testUniquenessAndValidation() throws Exception {
        int n = SEQ.incrementAndGet();
        String body = "{\"firstName\":\"Yaw\",\"familyName\":\"Boateng\",\"emailAddress\":\"yaw" + n
                + "@example.com\",\"username\":\"dup" + n + "\",\"password\":\"password1\"}";
        mockMvc.perform(post("/api/members").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isOk());
        mockMvc.perform(post("/api/members").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Username already exists"));

        mockMvc.perform(post("/api/members").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"familyName\":\"Boateng\",\"emailAddress\":\"not-an-email\","
                                + "\"username\":\"x" + n + "\",\"password\":\"password1\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value(400));

        mockMvc.perform(get("/api/members/{id}", 999999))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value("Member not found"));
    }

    @Test
    @DisplayName("T3: 分页总数只统计未删除成员")
    void testPaginationTotalsExcludeDeleted() throws Exception {
        registerMember("Esi");
        long removed = registerMember("Kojo");
        mockMvc.perform(delete("/api/members/{id}", removed)).andExpect(status().isOk());

        Long expected = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM churchmember WHERE deleted = FALSE", Long.class);

        MvcResult result = mockMvc.perform(get("/api/members").param("page", "1").param("limit", "2"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.pagination.limit").value(2))
                .andReturn();
        Number total = JsonPath.read(result.getResponse().getContentAsString(), "$.data.pagination.total");
        assertThat(total.longValue()).isEqualTo(expected);

        mockMvc.perform(get("/api/members/{id}", removed)).andExpect(status().isNotFound());
        mockMvc.perform(get("/api/members").param("limit", "500")).andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("T4: 有多名成员的家庭不能删除")
    void testFamilyDeleteBlocked() throws Exception {
        long head = registerMember("Kwesi");
        long child = registerMember("Abena");
        int n = SEQ.incrementAndGet();

        MvcResult created = mockMvc.perform(post("/api/families").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"familyName\":\"Household " + n + "\",\"headOfHouseholdId\":" + head
                                + ",\"branchId\":1}"))
                .andExpect(status().isOk())
                .andReturn();
        long familyId = idOf(created);

        mockMvc.perform(post("/api/families").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"familyName\":\"Household " + n + "\",\"headOfHouseholdId\":" + child
                                + ",\"branchId\":1}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Family name already exists"));

        mockMvc.perform(post("/api/families/{id}/members", familyId).contentType(MediaType.APPLICATION_JSON)
                        .content("{\"memberId\":" + child + ",\"role\":\"Child\"}"))
                .andExpect(status().isOk());

        mockMvc.perform(delete("/api/families/{id}", familyId))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Cannot delete family with multiple members"));

        mockMvc.perform(get("/api/families/{id}", familyId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.memberCount").value(2))
                .andExpect(jsonPath("$.data.members.length()").value(2));
    }

    @Test
    @DisplayName("T5: 有成员的小组不能删除，组长不能移出")
    void testGroupDeleteBlocked() throws Exception {
        long leader = registerMember("Efua");
        long member = registerMember("Kofi");
        int n = SEQ.incrementAndGet();

        MvcResult created = mockMvc.perform(post("/api/groups").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"groupName\":\"Choir " + n + "\",\"leaderId\":" + leader + ",\"typeId\":1}"))
                .andExpect(status().isOk())
                .andReturn();
        long groupId = idOf(created);

        mockMvc.perform(post("/api/groups/{g}/members/{m}", groupId, member)).andExpect(status().isOk());
        mockMvc.perform(post("/api/groups/{g}/members/{m}", groupId, member))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Member is already in this group"));

        mockMvc.perform(delete("/api/groups/{id}", groupId))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Cannot delete group with members or communications"));

        mockMvc.perform(get("/api/groups/{id}/members", groupId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.pagination.total").value(1));
    }

    @Test
    @DisplayName("T6: 志愿者批量分配，任一无效则整批回滚")
    void testVolunteerBatchRollback() throws Exception {
        long valid = registerMember("Adwoa");
        long removed = registerMember("Yaa");
        mockMvc.perform(delete("/api/members/{id}", removed)).andExpect(status().isOk());
        String bearer = "Bearer " + accessTokenFor(valid);

        mockMvc.perform(post("/api/events/1/volunteers").header(HttpHeaders.AUTHORIZATION, bearer)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"volunteers\":[{\"memberId\":" + valid + ",\"roleId\":1},{\"memberId\":"
                                + removed + "}]}"))
                .andExpect(status().isBadRequest());

        Long afterFailure = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM event_volunteer WHERE event_id = 1 AND mbr_id = ?", Long.class, valid);
        assertThat(afterFailure).isZero();

        mockMvc.perform(post("/api/events/1/volunteers").header(HttpHeaders.AUTHORIZATION, bearer)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"volunteers\":[{\"memberId\":" + valid + ",\"roleId\":1}]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.assigned").value(1));

        mockMvc.perform(post("/api/events/1/volunteers").header(HttpHeaders.AUTHORIZATION, bearer)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"volunteers\":[{\"memberId\":" + valid + "}]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.assigned").value(0))
                .andExpect(jsonPath("$.data.skippedMemberIds[0]").value(valid));

        mockMvc.perform(post("/api/events/1/volunteers")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"volunteers\":[{\"memberId\":" + valid + "}]}"))
                .andExpect(status().isUnauthorized());

        // 伪造的成员 ID 请求头不再被采信
        mockMvc.perform(post("/api/events/1/volunteers").header("X-Member-Id", valid)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"volunteers\":[{\"memberId\":" + valid + "}]}"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.message").value("Authentication token missing"));
    }

    @Test
    @DisplayName("T7: 权限名唯一，已分配给角色的权限不能删除")
    void testPermissionConstraints() throws Exception {
        mockMvc.perform(post("/api/permissions").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"permissionName\":\"view_members\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Permission name already exists"));

        mockMvc.perform(delete("/api/permissions/1"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Cannot delete permission assigned to roles"));

        mockMvc.perform(get("/api/permissions/1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.permissionName").value("view_members"))
                .andExpect(jsonPath("$.data.roles[0].roleName").value("Super Admin"));
    }

    @Test
    @DisplayName("T8: 预算审批流程与预算执行报表")
    void testBudgetWorkflowAndReport() throws Exception {
        MvcResult created = mockMvc.perform(post("/api/budgets").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"fiscalYearId\":1,\"categoryId\":2,\"branchId\":1,\"amount\":500.00}"))
                .andExpect(status().isOk())
                .andReturn();
        long budgetId = idOf(created);

        mockMvc.perform(post("/api/budgets/{id}/submit", budgetId)).andExpect(status().isOk());
        mockMvc.perform(post("/api/budgets/{id}/review", budgetId).contentType(MediaType.APPLICATION_JSON)
                        .content("{\"action\":\"approve\",\"remarks\":\"ok\"}"))
                .andExpect(status().isOk());
        mockMvc.perform(delete("/api/budgets/{id}", budgetId))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Cannot delete approved budget"));

        mockMvc.perform(post("/api/budgets").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"fiscalYearId\":1,\"categoryId\":2,\"branchId\":1,\"amount\":-1}"))
                .andExpect(status().isBadRequest());

        mockMvc.perform(get("/api/finance/budget-vs-actual/1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.fiscalYearId").value(1));
        mockMvc.perform(get("/api/finance/income-statement/999"))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("T9: 奉献合计排除已删除记录")
    void testContributionTotal() throws Exception {
        long member = registerMember("Ekow");
        String today = LocalDate.now().toString();

        mockMvc.perform(post("/api/contributions").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"amount\":100.5,\"contributionDate\":\"" + today + "\",\"contributionTypeId\":1,"
                                + "\"paymentOptionId\":1,\"memberId\":" + member + ",\"fiscalYearId\":1}"))
                .andExpect(status().isOk());
        MvcResult second = mockMvc.perform(post("/api/contributions").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"amount\":40,\"contributionDate\":\"" + today + "\",\"contributionTypeId\":2,"
                                + "\"paymentOptionId\":1,\"memberId\":" + member + ",\"fiscalYearId\":1}"))
                .andExpect(status().isOk())
                .andReturn();
        mockMvc.perform(delete("/api/contributions/{id}", idOf(second))).andExpect(status().isOk());

        mockMvc.perform(get("/api/contributions/total").param("memberId", String.valueOf(member)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.total").value("100.50"));

        mockMvc.perform(post("/api/contributions").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"amount\":10,\"contributionDate\":\"" + LocalDate.now().plusDays(2)
                                + "\",\"contributionTypeId\":1,\"paymentOptionId\":1,\"memberId\":" + member
                                + ",\"fiscalYearId\":1}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Contribution date cannot be in the future"));
    }

    @Test
    @DisplayName("T10: 登录、刷新令牌轮换与登出")
    void testLoginRefreshLogout() throws Exception {
        long member = registerMember("Nana");
        String username = jdbcTemplate.queryForObject(
                "SELECT username FROM userauthentication WHERE mbr_id = ?", String.class, member);

        login(username, "wrong-password")
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.message").value("Invalid credentials"));
        login(username, "")
                .andExpect(status().isBadRequest());

        MvcResult result = login(username, username.replace("user", "password"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.tokenType").value("Bearer"))
                .andExpect(jsonPath("$.data.memberId").value(member))
                .andExpect(jsonPath("$.data.roles[0]").value("Member"))
                .andReturn();
        String refreshToken = JsonPath.read(result.getResponse().getContentAsString(), "$.data.refreshToken");

        MvcResult refreshed = mockMvc.perform(post("/api/auth/refresh").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"refreshToken\":\"" + refreshToken + "\"}"))
                .andExpect(status().isOk())
                .andReturn();
        String rotated = JsonPath.read(refreshed.getResponse().getContentAsString(), "$.data.refreshToken");
        assertThat(rotated).isNotEqualTo(refreshToken);

        // 旧的刷新令牌已吊销
        mockMvc.perform(post("/api/auth/refresh").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"refreshToken\":\"" + refreshToken + "\"}"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.message").value("Refresh token revoked or invalid"));

        mockMvc.perform(post("/api/auth/logout").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"refreshToken\":\"" + rotated + "\"}"))
                .andExpect(status().isOk());
        mockMvc.perform(post("/api/auth/refresh").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"refreshToken\":\"" + rotated + "\"}"))
                .andExpect(status().isUnauthorized());
    }

    @Test
    @DisplayName("T11: 支出审批流程与支出报表")
    void testExpenseWorkflowAndReports() throws Exception {
        long requester = registerMember("Afua");
        String today = LocalDate.now().toString();

        MvcResult created = mockMvc.perform(post("/api/expenses").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"title\":\"Hall rental\",\"amount\":75.00,\"expenseDate\":\"" + today
                                + "\",\"categoryId\":1,\"fiscalYearId\":1,\"memberId\":" + requester + "}"))
                .andExpect(status().isOk())
                .andReturn();
        long expenseId = idOf(created);

        mockMvc.perform(post("/api/expenses/{id}/review", expenseId).contentType(MediaType.APPLICATION_JSON)
                        .content("{\"status\":\"Maybe\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Invalid approval status"));
        mockMvc.perform(post("/api/expenses/{id}/review", expenseId).contentType(MediaType.APPLICATION_JSON)
                        .content("{\"status\":\"Approved\",\"comments\":\"ok\"}"))
                .andExpect(status().isOk());
        mockMvc.perform(post("/api/expenses/{id}/review", expenseId).contentType(MediaType.APPLICATION_JSON)
                        .content("{\"status\":\"Declined\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Expense is already processed"));
        mockMvc.perform(delete("/api/expenses/{id}", expenseId))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Cannot delete approved or declined expense"));

        mockMvc.perform(get("/api/expenses/{id}", expenseId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.status").value("Approved"))
                .andExpect(jsonPath("$.data.categoryName").value("Utilities"))
                .andExpect(jsonPath("$.data.approvals.length()").value(1));

        Long notices = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM communication WHERE title = 'Expense Approved' AND target_member_id = ?",
                Long.class, requester);
        assertThat(notices).isEqualTo(1L);

        mockMvc.perform(get("/api/expenses/reports/by_category").param("fiscal_year_id", "1"))
                .andExpect(status().isOk());
        mockMvc.perform(get("/api/expenses/reports/by_month").param("year", String.valueOf(LocalDate.now().getYear())))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.length()").value(greaterThanOrEqualTo(1)));
        mockMvc.perform(get("/api/expenses/reports/by_weekday"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Invalid report type"));

        mockMvc.perform(delete("/api/expense-categories/1"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Cannot delete category used in expenses"));
    }

    @Test
    @DisplayName("T12: 活动创建需要登录，删除时连同志愿者分配")
    void testEventLifecycle() throws Exception {
        long organiser = registerMember("Kwame");
        String bearer = "Bearer " + accessTokenFor(organiser);
        String body = "{\"title\":\"Youth Camp\",\"eventDate\":\"" + LocalDate.now().plusDays(30)
                + "\",\"branchId\":1}";

        mockMvc.perform(post("/api/events").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isUnauthorized());
        mockMvc.perform(post("/api/events").header(HttpHeaders.AUTHORIZATION, bearer)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"title\":\"Past\",\"eventDate\":\"" + LocalDate.now() + "\",\"branchId\":1}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Event date must be in the future"));

        MvcResult created = mockMvc.perform(post("/api/events").header(HttpHeaders.AUTHORIZATION, bearer)
                        .contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isOk())
                .andReturn();
        long eventId = idOf(created);

        mockMvc.perform(get("/api/events/{id}", eventId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.createdBy").value(organiser))
                .andExpect(jsonPath("$.data.branchName").value("Main Branch"));

        mockMvc.perform(post("/api/events/{id}/volunteers", eventId).header(HttpHeaders.AUTHORIZATION, bearer)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"volunteers\":[{\"memberId\":" + organiser + "}]}"))
                .andExpect(status().isOk());

        mockMvc.perform(delete("/api/events/{id}", eventId)).andExpect(status().isOk());
        Long volunteers = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM event_volunteer WHERE event_id = ?", Long.class, eventId);
        assertThat(volunteers).isZero();
        mockMvc.perform(get("/api/events/{id}", eventId)).andExpect(status().isNotFound());
    }
}
