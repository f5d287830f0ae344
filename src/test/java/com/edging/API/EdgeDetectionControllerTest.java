package com.edging.API;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.HashMap;
import java.util.Map;

import static org.hamcrest.Matchers.closeTo;
import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
public class EdgeDetectionControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    private static Map<String, Object> body(int rows, int cols, int channels, double[] data) {
        Map<String, Object> body = new HashMap<>();
        body.put("rows", rows);
        body.put("cols", cols);
        body.put("channels", channels);
        body.put("data", data);
        return body;
    }

    private static double[] verticalStep() {
        double[] data = new double[25];
        for (int y = 0; y < 5; y++)
            for (int x = 2; x < 5; x++)
                data[y * 5 + x] = 100.0;
        return data;
    }

    private String json(Object value) throws Exception {
        return objectMapper.writeValueAsString(value);
    }

    @Test
    public void testCannyEndpoint() throws Exception {
        Map<String, Object> request = body(5, 5, 1, verticalStep());
        request.put("highRatio", 0.5);
        request.put("lowRatio", 0.2);
        request.put("border", "reflect");

        mockMvc.perform(post("/api/canny").contentType(MediaType.APPLICATION_JSON).content(json(request)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.rows").value(5))
                .andExpect(jsonPath("$.cols").value(5))
                .andExpect(jsonPath("$.channels").value(1))
                .andExpect(jsonPath("$.edgeCount").value(3))
                .andExpect(jsonPath("$.data", hasSize(25)));
    }

    @Test
    public void testCannyUsesConfiguredDefaults() throws Exception {
        mockMvc.perform(post("/api/canny").contentType(MediaType.APPLICATION_JSON)
                        .content(json(body(5, 5, 1, verticalStep()))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.edgeCount").value(3));
    }

    @Test
    public void testInvalidThresholdIsBadRequest() throws Exception {
        Map<String, Object> request = body(5, 5, 1, verticalStep());
        request.put("highRatio", 0.2);
        request.put("lowRatio", 0.6);

        mockMvc.perform(post("/api/canny").contentType(MediaType.APPLICATION_JSON).content(json(request)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("INVALID_THRESHOLD"));
    }

    @Test
    public void testShapeMismatchIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/smooth").contentType(MediaType.APPLICATION_JSON)
                        .content(json(body(3, 3, 1, new double[8]))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("SHAPE_MISMATCH"));

        mockMvc.perform(post("/api/gray").contentType(MediaType.APPLICATION_JSON)
                        .content(json(body(2, 2, 1, new double[4]))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("SHAPE_MISMATCH"));
    }

    @Test
    public void testUnknownBorderIsBadRequest() throws Exception {
        Map<String, Object> request = body(3, 3, 1, new double[9]);
        request.put("border", "wrap");

        mockMvc.perform(post("/api/sobel-norm").contentType(MediaType.APPLICATION_JSON).content(json(request)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("BAD_REQUEST"));
    }

    @Test
    public void testMissingFieldsAreBadRequest() throws Exception {
        Map<String, Object> request = new HashMap<>();
        request.put("rows", 3);

        mockMvc.perform(post("/api/canny").contentType(MediaType.APPLICATION_JSON).content(json(request)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("BAD_REQUEST"));
    }

    @Test
    public void testOversizedExtentsAreBadRequest() throws Exception {
        Map<String, Object> request = body(2048, 2048, 1024, new double[0]);
        request.put("kernelSize", 1);

        mockMvc.perform(post("/api/smooth").contentType(MediaType.APPLICATION_JSON).content(json(request)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("BAD_REQUEST"));

        mockMvc.perform(post("/api/canny").contentType(MediaType.APPLICATION_JSON)
                        .content(json(body(65536, 65537, 1, new double[1]))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("BAD_REQUEST"));
    }

    @Test
    public void testGrayEndpoint() throws Exception {
        double[] rgb = new double[2 * 2 * 3];
        java.util.Arrays.fill(rgb, 10.0);

        mockMvc.perform(post("/api/gray").contentType(MediaType.APPLICATION_JSON).content(json(body(2, 2, 3, rgb))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.channels").value(1))
                .andExpect(jsonPath("$.data", hasSize(4)))
                .andExpect(jsonPath("$.data[0]").value(closeTo(10.0, 1e-9)))
                .andExpect(jsonPath("$.edgeCount").doesNotExist());
    }

    @Test
    public void testSmoothAndSobelNormEndpoints() throws Exception {
        double[] flat = new double[36];
        java.util.Arrays.fill(flat, 5.0);

        mockMvc.perform(post("/api/smooth").contentType(MediaType.APPLICATION_JSON).content(json(body(6, 6, 1, flat))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data[14]").value(closeTo(5.0, 1e-9)));

        Map<String, Object> request = body(6, 6, 1, flat);
        request.put("norm", "l1");
        request.put("border", "replicate");
        mockMvc.perform(post("/api/sobel-norm").contentType(MediaType.APPLICATION_JSON).content(json(request)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data[14]").value(closeTo(0.0, 1e-12)));
    }
}
