package com.trendscope.interfaces.api.analysis;

import com.trendscope.application.analysis.AnalysisAppService;
import com.trendscope.interfaces.api.dto.AnalyseRequest;
import com.trendscope.interfaces.api.dto.AnalyseResponse;
import com.trendscope.interfaces.api.dto.FrequencyRequest;
import com.trendscope.interfaces.api.dto.FrequencyResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/analysis")
@RequiredArgsConstructor
public class AnalysisController {

    private final AnalysisAppService analysisAppService;

    @PostMapping
    public ResponseEntity<AnalyseResponse> analyse(@Valid @RequestBody AnalyseRequest request) {
        return ResponseEntity.ok(AnalyseResponse.from(
                analysisAppService.analyse(request.text(), Boolean.TRUE.equals(request.noFilter()))));
    }

    @PostMapping("/frequencies")
    public ResponseEntity<FrequencyResponse> frequencies(@Valid @RequestBody FrequencyRequest request) {
        return ResponseEntity.ok(FrequencyResponse.from(
                analysisAppService.frequencies(request.posts(), Boolean.TRUE.equals(request.noFilter()))));
    }
}
