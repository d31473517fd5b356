package com.mk.fx.qa.device.load.resource;

import static org.hamcrest.Matchers.containsString;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mk.fx.qa.device.load.coordinator.RunContext;
import com.mk.fx.qa.device.load.coordinator.RunState;
import com.mk.fx.qa.device.load.dto.api.RunRequest;
import com.mk.fx.qa.device.load.dto.api.RunStatusResponse;
import com.mk.fx.qa.device.load.identity.WorkerCountMismatchException;
import com.mk.fx.qa.device.load.service.DeviceRunService;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(controllers = RunController.class)
@Import({ApiResponseFactory.class, GlobalExceptionHandler.class})
class RunControllerTest {

  @Autowired MockMvc mvc;
  @Autowired ObjectMapper mapper;

  @MockBean DeviceRunService runService;

  private static RunRequest request(String scenario, int users) {
    RunRequest req = new RunRequest();
    req.setScenario(scenario);
    req.setUsers(users);
    return req;
  }

  @Test
  void startRun_acceptedWithRunContext() throws Exception {
    var context = new RunContext("run-1", "device-pool", 10, Instant.now());
    when(runService.startRun(any())).thenReturn(context);

    mvc.perform(
            post("/api/runs")
                .contentType(MediaType.APPLICATION_JSON)
                .content(mapper.writeValueAsString(request("device-pool", 10))))
        .andExpect(status().isAccepted())
        .andExpect(jsonPath("$.runId").value("run-1"))
        .andExpect(jsonPath("$.scenarioName").value("device-pool"))
        .andExpect(jsonPath("$.expectedWorkerCount").value(10));
  }

  @Test
  void startRun_workerCountMismatch_badRequestNamingBothCounts() throws Exception {
    when(runService.startRun(any())).thenThrow(new WorkerCountMismatchException(10, 5));

    mvc.perform(
            post("/api/runs")
                .contentType(MediaType.APPLICATION_JSON)
                .content(mapper.writeValueAsString(request("device-pool", 5))))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.error").value("Worker Count Mismatch"))
        .andExpect(jsonPath("$.details").value(containsString("10")))
        .andExpect(jsonPath("$.details").value(containsString("5")));
  }

  @Test
  void startRun_whileBusy_conflict() throws Exception {
    when(runService.startRun(any())).thenThrow(new IllegalStateException("A run is already active"));

    mvc.perform(
            post("/api/runs")
                .contentType(MediaType.APPLICATION_JSON)
                .content(mapper.writeValueAsString(request("light-load", 1))))
        .andExpect(status().isConflict());
  }

  @Test
  void startRun_unknownScenario_badRequest() throws Exception {
    when(runService.startRun(any())).thenThrow(new IllegalArgumentException("Unknown scenario x"));

    mvc.perform(
            post("/api/runs")
                .contentType(MediaType.APPLICATION_JSON)
                .content(mapper.writeValueAsString(request("x", 1))))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.details").value("Unknown scenario x"));
  }

  @Test
  void startRun_invalidBody_badRequest() throws Exception {
    mvc.perform(
            post("/api/runs")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"scenario\": \"\", \"users\": 0}"))
        .andExpect(status().isBadRequest());
  }

  @Test
  void currentRun_returnsCoordinatorState() throws Exception {
    when(runService.status())
        .thenReturn(
            new RunStatusResponse(
                RunState.RUNNING,
                new RunContext("run-1", "light-load", 3, Instant.now()),
                3,
                12,
                1,
                null));

    mvc.perform(get("/api/runs/current"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.state").value("RUNNING"))
        .andExpect(jsonPath("$.currentRun.runId").value("run-1"))
        .andExpect(jsonPath("$.droppedCount").value(1));
  }

  @Test
  void stopRun_noActiveRun_notFound() throws Exception {
    when(runService.stopRun()).thenReturn(Optional.empty());

    mvc.perform(delete("/api/runs/current")).andExpect(status().isNotFound());
  }

  @Test
  void stopRun_activeRun_accepted() throws Exception {
    when(runService.stopRun())
        .thenReturn(Optional.of(new RunContext("run-1", "light-load", 3, Instant.now())));

    mvc.perform(delete("/api/runs/current"))
        .andExpect(status().isAccepted())
        .andExpect(jsonPath("$.runId").value("run-1"));
  }

  @Test
  void scenarios_listsConfiguredNames() throws Exception {
    when(runService.scenarioNames())
        .thenReturn(new LinkedHashSet<>(List.of("light-load", "device-pool")));

    mvc.perform(get("/api/scenarios"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[0]").value("light-load"))
        .andExpect(jsonPath("$[1]").value("device-pool"));
  }
}
