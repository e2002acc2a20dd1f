package com.devevent.registry;

import com.devevent.registry.domain.model.Event;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.http.MediaType;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.context.WebApplicationContext;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest(classes = DevEventRegistryApplication.class)
@Testcontainers(disabledWithoutDocker = true)
@ActiveProfiles("test")
@TestPropertySource(properties = {
        "devevent.cache.enabled=true",
        "devevent.cache.ttl-minutes=5",
        "logging.level.com.devevent.registry=DEBUG"
})
class DevEventRegistryIntegrationTest {

    private static final String EVENT_JSON = """
            {
              "title": "  Next.js Conf 2025 ",
              "description": "The Next.js conference",
              "overview": "Talks and workshops",
              "image": "/images/nextjs.png",
              "venue": "SF Jazz",
              "location": "San Francisco, US",
              "date": "2025-10-22T17:00:00Z",
              "time": "9:5",
              "mode": "hybrid",
              "audience": "Web developers",
              "agenda": ["Keynote", "Deep dives"],
              "organizer": "Vercel",
              "tags": ["nextjs", "react"]
            }
            """;

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:15-alpine")
            .withDatabaseName("devevent_test")
            .withUsername("test")
            .withPassword("test");

    @Container
    static GenericContainer<?> redis = new GenericContainer<>(DockerImageName.parse("redis:7-alpine"))
            .withExposedPorts(6379)
            .withCommand("redis-server", "--save", "", "--appendonly", "no");

    @Autowired
    private WebApplicationContext webApplicationContext;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @Autowired
    private StringRedisTemplate redisTemplate;

    @Autowired
    private ObjectMapper objectMapper;

    private MockMvc mockMvc;

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.data.redis.host", redis::getHost);
        registry.add("spring.data.redis.port", () -> redis.getMappedPort(6379));
    }

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.webAppContextSetup(webApplicationContext).build();
    }

    @AfterEach
    void tearDown() {
        jdbcTemplate.execute("DELETE FROM bookings");
        jdbcTemplate.execute("DELETE FROM events");
        var keys = redisTemplate.keys("devevent:event:*");
        if (keys != null && !keys.isEmpty()) {
            redisTemplate.delete(keys);
        }
    }

    @Test
    void shouldNormalizeAndStoreEventThenServeItBySlug() throws Exception {
        // When
        mockMvc.perform(post("/api/events")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(EVENT_JSON))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.title", is("Next.js Conf 2025")))
                .andExpect(jsonPath("$.slug", is("next-js-conf-2025")))
                .andExpect(jsonPath("$.date", is("2025-10-22")))
                .andExpect(jsonPath("$.time", is("09:05")))
                .andExpect(jsonPath("$.id", notNullValue()));

        // Then
        mockMvc.perform(get("/api/events/{slug}", "next-js-conf-2025"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.venue", is("SF Jazz")));

        assertThat(redisTemplate.opsForValue().get("devevent:event:slug:next-js-conf-2025")).isNotNull();
    }

    @Test
    void shouldRejectSecondEventDerivingSameSlug() throws Exception {
        mockMvc.perform(post("/api/events").contentType(MediaType.APPLICATION_JSON).content(EVENT_JSON))
                .andExpect(status().isCreated());

        mockMvc.perform(post("/api/events")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(EVENT_JSON.replace("Next.js Conf 2025", "next js conf 2025")))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error", is("SLUG_CONFLICT")));

        Integer count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM events", Integer.class);
        assertThat(count).isEqualTo(1);
    }

    @Test
    void shouldRejectInvalidEventWithoutWriting() throws Exception {
        mockMvc.perform(post("/api/events")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(EVENT_JSON.replace("\"9:5\"", "\"25:00\"")))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error", is("INVALID_TIME_VALUE")))
                .andExpect(jsonPath("$.field", is("time")));

        Integer count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM events", Integer.class);
        assertThat(count).isZero();
    }

    @Test
    void shouldRegenerateSlugAndEvictOldCacheEntryOnRename() throws Exception {
        // Given
        Event created = createEvent();
        mockMvc.perform(get("/api/events/{slug}", created.slug())).andExpect(status().isOk());

        // When
        mockMvc.perform(put("/api/events/{id}", created.id())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"title\": \"Next.js Conf EU\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.slug", is("next-js-conf-eu")))
                .andExpect(jsonPath("$.date", is("2025-10-22")));

        // Then
        mockMvc.perform(get("/api/events/{slug}", "next-js-conf-2025"))
                .andExpect(status().isNotFound());
        mockMvc.perform(get("/api/events/{slug}", "next-js-conf-eu"))
                .andExpect(status().isOk());
    }

    @Test
    void shouldBookExistingEventAndListBookings() throws Exception {
        // Given
        Event created = createEvent();

        // When
        mockMvc.perform(post("/api/bookings")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"eventId\": \"" + created.id() + "\", \"email\": \" Grace@Example.COM \"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.email", is("grace@example.com")));

        // Then
        mockMvc.perform(get("/api/events/{id}/bookings", created.id()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].eventId", is(created.id().toString())));
    }

    @Test
    void shouldRejectBookingForUnknownEvent() throws Exception {
        mockMvc.perform(post("/api/bookings")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"eventId\": \"5b0c7f3e-8a51-4c2d-9e8f-1a2b3c4d5e6f\", \"email\": \"grace@example.com\"}"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error", is("DANGLING_EVENT_REFERENCE")));

        Integer count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM bookings", Integer.class);
        assertThat(count).isZero();
    }

    private Event createEvent() throws Exception {
        MvcResult result = mockMvc.perform(post("/api/events")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(EVENT_JSON))
                .andExpect(status().isCreated())
                .andReturn();
        JsonNode body = objectMapper.readTree(result.getResponse().getContentAsString());
        return objectMapper.treeToValue(body, Event.class);
    }
}
