package com.phillippitts.mathwords.presentation.controller;

import com.phillippitts.mathwords.presentation.dto.BatchRequest;
import com.phillippitts.mathwords.presentation.dto.BatchResponse;
import com.phillippitts.mathwords.presentation.dto.VerbalizeRequest;
import com.phillippitts.mathwords.presentation.dto.VerbalizeResponse;
import com.phillippitts.mathwords.presentation.dto.VersionResponse;
import com.phillippitts.mathwords.service.MathWordsService;
import com.phillippitts.mathwords.service.MathWordsVersion;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST adapter over {@link MathWordsService}. Errors are mapped by {@code GlobalExceptionHandler}.
 */
@RestController
@RequestMapping("/api/v1")
class VerbalizationController {

    private static final Logger LOG = LogManager.getLogger(VerbalizationController.class);

    private final MathWordsService service;

    VerbalizationController(MathWordsService service) {
        this.service = service;
    }

    @PostMapping("/verbalize")
    ResponseEntity<VerbalizeResponse> verbalize(@RequestBody VerbalizeRequest request) {
        String style = request.speechStyle() == null ? service.getDefaultStyle() : request.speechStyle();
        LOG.info("Verbalize request: style={}, displayMode={}, format={}", style, request.isDisplayMode(),
                request.format() == null ? "LATEX" : request.format());
        String text = service.verbalize(request.expression(), request.format(), request.isDisplayMode(), style);
        return ResponseEntity.ok(new VerbalizeResponse(text, style, request.isDisplayMode()));
    }

    @PostMapping("/verbalize/batch")
    ResponseEntity<BatchResponse> verbalizeBatch(@RequestBody BatchRequest request) {
        List<String> results = service.verbalizeBatch(request.items(), request.speechStyle());
        LOG.info("Batch request returned {} results", results.size());
        return ResponseEntity.ok(new BatchResponse(results));
    }

    @GetMapping("/styles")
    ResponseEntity<List<String>> styles() {
        return ResponseEntity.ok(service.getSpeechStyles());
    }

    @GetMapping("/version")
    ResponseEntity<VersionResponse> version() {
        return ResponseEntity.ok(new VersionResponse(MathWordsVersion.VERSION));
    }
}
