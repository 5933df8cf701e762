package com.segments.api;

import com.segments.domain.exception.StoreException;
import com.segments.domain.model.TableList;
import com.segments.domain.model.TableName;
import com.segments.domain.model.TablePreview;
import com.segments.domain.service.TableService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;
import java.util.Map;

import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@ExtendWith(MockitoExtension.class)
class TableControllerTest {

    @Mock
    private TableService tableService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new TableController(tableService))
                .setControllerAdvice(new ApiExceptionHandler())
                .build();
    }

    @Test
    void testHealth() throws Exception {
        mockMvc.perform(get("/api/v1/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("ok"));
    }

    @Test
    void testHealth_StoreDown() throws Exception {
        doThrow(new StoreException("Database error: Connection refused", null)).when(tableService).checkHealth();

        mockMvc.perform(get("/api/v1/health"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error").value("STORE_ERROR"))
                .andExpect(jsonPath("$.detail").value("Database error: Connection refused"));
    }

    @Test
    void testListTables() throws Exception {
        when(tableService.listTables()).thenReturn(new TableList(List.of("user_cluster", "users (2024)")));

        mockMvc.perform(get("/api/v1/tables"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.tables[1]").value("users (2024)"));
    }

    @Test
    void testPreview() throws Exception {
        when(tableService.preview(TableName.of("user_cluster"), 2))
                .thenReturn(new TablePreview("user_cluster", 1, List.of(Map.of("Name", "Asha"))));

        mockMvc.perform(get("/api/v1/tables/user_cluster").param("limit", "2"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.rows[0].Name").value("Asha"));
    }

    @Test
    void testPreview_InvalidName() throws Exception {
        mockMvc.perform(get("/api/v1/tables/{tableName}", "user*cluster"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("VALIDATION_ERROR"));

        verifyNoInteractions(tableService);
    }

    @Test
    void testPreview_LimitOutOfRange() throws Exception {
        mockMvc.perform(get("/api/v1/tables/user_cluster").param("limit", "101"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("VALIDATION_ERROR"));
        mockMvc.perform(get("/api/v1/tables/user_cluster").param("limit", "0"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("VALIDATION_ERROR"));

        verifyNoInteractions(tableService);
    }
}
