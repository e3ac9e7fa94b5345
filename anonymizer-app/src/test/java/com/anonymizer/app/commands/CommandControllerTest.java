package com.anonymizer.app.commands;

import com.anonymizer.app.router.CommandRouter;
import com.anonymizer.app.router.FakeSidecarBridge;
import com.anonymizer.sidecar.SidecarCommand;
import com.anonymizer.sidecar.SidecarException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class CommandControllerTest {

    private final FakeSidecarBridge bridge = new FakeSidecarBridge();
    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        var dispatcher = new HostCommandDispatcher(
                new AnalysisCommands(new CommandRouter(bridge)),
                new StatusCommands(SidecarCommand.of("python"), SidecarCommand.of("python")));
        mvc = MockMvcBuilders.standaloneSetup(new CommandController(dispatcher)).build();
    }

    @Test
    void invoke_returnsSnakeCaseData() throws Exception {
        bridge.respondWith("""
                {"run_id":"r9","run_folder":"/runs/r9","output_path":"/runs/r9/a.txt",
                 "summary":{"PERSON":1},"findings_count":1}""");

        mvc.perform(post("/api/commands/analyze_file")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"inputPath\":\"/a.txt\",\"preset\":\"layer1_fast_legal_scrub\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.ok").value(true))
                .andExpect(jsonPath("$.data.run_id").value("r9"))
                .andExpect(jsonPath("$.data.findings_count").value(1))
                .andExpect(jsonPath("$.error").doesNotExist());
    }

    @Test
    void invoke_withoutBody() throws Exception {
        bridge.respondWith("{\"extensions\":[\".txt\"]}");

        mvc.perform(post("/api/commands/get_supported_extensions"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.extensions[0]").value(".txt"));
    }

    @Test
    void workerFailure_isHandledError() throws Exception {
        bridge.failWith(SidecarException.nonZeroExit("get_supported_extensions", 1, "no engine"));

        mvc.perform(post("/api/commands/get_supported_extensions"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.ok").value(false))
                .andExpect(jsonPath("$.data").doesNotExist())
                .andExpect(jsonPath("$.error").value(org.hamcrest.Matchers.containsString("no engine")));
    }

    @Test
    void unknownCommand_is404() throws Exception {
        mvc.perform(post("/api/commands/analyze_docx"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.ok").value(false))
                .andExpect(jsonPath("$.error").value("Unknown command: analyze_docx"));
    }

    @Test
    void list_namesCommands() throws Exception {
        mvc.perform(get("/api/commands"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.commands[0]").value("analyze_text"));
    }
}
