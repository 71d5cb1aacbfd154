package io.stackwarden.orchestrator.api;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.stackwarden.orchestrator.app.MaintenanceObserverService;
import io.stackwarden.orchestrator.domain.ObserverResult;
import io.stackwarden.orchestrator.domain.StackKey;
import io.stackwarden.orchestrator.domain.StackNotFoundException;
import java.time.Instant;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
class MaintenanceObserverControllerTest {

    private static final StackKey SHOP = new StackKey("staging", "shop");
    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    @Mock
    MaintenanceObserverService observers;

    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        ObjectMapper mapper = new ObjectMapper().findAndRegisterModules()
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mvc = MockMvcBuilders.standaloneSetup(new MaintenanceObserverController(observers))
            .setControllerAdvice(new ApiExceptionHandler())
            .setMessageConverters(new MappingJackson2HttpMessageConverter(mapper))
            .build();
    }

    @Test
    void lastResultIsReturned() throws Exception {
        when(observers.lastResult(SHOP)).thenReturn(Optional.of(ObserverResult.maintenance("on", NOW)));

        mvc.perform(get("/api/environments/staging/stacks/shop/maintenance-observer"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.observedValue").value("on"))
            .andExpect(jsonPath("$.maintenanceRequired").value(true))
            .andExpect(jsonPath("$.checkedAt").value("2026-03-01T10:00:00Z"));
    }

    @Test
    void noResultYetIsNotFound() throws Exception {
        when(observers.lastResult(SHOP)).thenReturn(Optional.empty());

        mvc.perform(get("/api/environments/staging/stacks/shop/maintenance-observer"))
            .andExpect(status().isNotFound());
    }

    @Test
    void checkReturnsTheFreshResult() throws Exception {
        when(observers.check(SHOP)).thenReturn(Optional.of(ObserverResult.failed("maybe", "Unexpected value: maybe", NOW)));

        mvc.perform(post("/api/environments/staging/stacks/shop/maintenance-observer/check"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.success").value(false))
            .andExpect(jsonPath("$.error").value("Unexpected value: maybe"));
    }

    @Test
    void checkOfUnknownStackIsNotFound() throws Exception {
        when(observers.check(SHOP)).thenThrow(StackNotFoundException.stack(SHOP));

        mvc.perform(post("/api/environments/staging/stacks/shop/maintenance-observer/check"))
            .andExpect(status().isNotFound());
    }
}
