package com.edging.API;

import com.edging.CannyEdgeDetector.EdgeMap;
import com.edging.filter_convolution.BorderType;
import com.edging.gradient.GradientNorm;
import com.edging.imageOperator.Dense2DArray;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

@RestController
@RequestMapping("/api")
public class EdgeDetectionController {
    private static final Logger logger = LoggerFactory.getLogger(EdgeDetectionController.class);

    private final EdgeDetectionService edgeDetectionService;

    public EdgeDetectionController(EdgeDetectionService edgeDetectionService) {
        this.edgeDetectionService = edgeDetectionService;
    }

    @PostMapping("/canny")
    public ResponseEntity<?> canny(@RequestBody ArrayRequest request) {
        ResponseEntity<?> invalid = checkRequest(request);
        if (invalid != null) return invalid;

        EdgeMap edges = edgeDetectionService.canny(toArray(request), request.highRatio, request.lowRatio,
                parseEnum(BorderType.class, request.border));
        return ResponseEntity.ok(ArrayResponse.edges(edges.getArray(), edges.edgeCount()));
    }

    @PostMapping("/smooth")
    public ResponseEntity<?> smooth(@RequestBody ArrayRequest request) {
        ResponseEntity<?> invalid = checkRequest(request);
        if (invalid != null) return invalid;

        Dense2DArray smoothed = edgeDetectionService.smooth(toArray(request), request.kernelSize,
                parseEnum(BorderType.class, request.border));
        return ResponseEntity.ok(ArrayResponse.of(smoothed));
    }

    @PostMapping("/sobel-norm")
    public ResponseEntity<?> sobelNorm(@RequestBody ArrayRequest request) {
        ResponseEntity<?> invalid = checkRequest(request);
        if (invalid != null) return invalid;

        Dense2DArray norm = edgeDetectionService.sobelNorm(toArray(request),
                parseEnum(GradientNorm.class, request.norm), parseEnum(BorderType.class, request.border));
        return ResponseEntity.ok(ArrayResponse.of(norm));
    }

    @PostMapping("/gray")
    public ResponseEntity<?> gray(@RequestBody ArrayRequest request) {
        ResponseEntity<?> invalid = checkRequest(request);
        if (invalid != null) return invalid;

        return ResponseEntity.ok(ArrayResponse.of(edgeDetectionService.gray(toArray(request))));
    }

    private ResponseEntity<?> checkRequest(ArrayRequest request) {
        if (request == null || request.rows == null || request.cols == null || request.data == null) {
            return badRequest("Fields rows, cols and data are required.");
        }
        int channels = request.channels != null ? request.channels : 1;
        if (edgeDetectionService.exceedsPixelLimit(request.rows, request.cols, channels)) {
            logger.warn("Rejected {}x{}x{} array: pixel limit exceeded", request.rows, request.cols, channels);
            return badRequest("Array of " + request.rows + "x" + request.cols + "x" + channels
                    + " exceeds the pixel limit.");
        }
        return null;
    }

    private static ResponseEntity<Map<String, String>> badRequest(String message) {
        Map<String, String> error = new HashMap<>();
        error.put("error", "BAD_REQUEST");
        error.put("message", message);
        return ResponseEntity.badRequest().body(error);
    }

    private static Dense2DArray toArray(ArrayRequest request) {
        int channels = request.channels != null ? request.channels : 1;
        return Dense2DArray.of(request.rows, request.cols, channels, request.data);
    }

    private static <E extends Enum<E>> E parseEnum(Class<E> type, String name) {
        if (name == null || name.isBlank()) {
            return null;
        }
        return Enum.valueOf(type, name.trim().toUpperCase(Locale.ROOT));
    }
}
