package com.fstner.interfaces.api.recognition;

import com.fstner.application.recognition.EntityRecognitionAppService;
import com.fstner.interfaces.api.dto.RecognitionResponse;
import com.fstner.interfaces.api.dto.RecognizeTextRequest;
import com.fstner.interfaces.api.dto.RecognizeTokensRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/entities")
@RequiredArgsConstructor
public class RecognitionController {

    private final EntityRecognitionAppService recognitionAppService;

    @PostMapping("/recognize")
    public ResponseEntity<RecognitionResponse> recognize(@Valid @RequestBody RecognizeTextRequest request) {
        return ResponseEntity.ok(RecognitionResponse.from(recognitionAppService.recognize(request.text())));
    }

    @PostMapping("/recognize/tokens")
    public ResponseEntity<RecognitionResponse> recognizeTokens(@Valid @RequestBody RecognizeTokensRequest request) {
        return ResponseEntity.ok(RecognitionResponse.from(recognitionAppService.recognizeTokens(request.tokens())));
    }
}
