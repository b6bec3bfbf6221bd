package com.fstner.interfaces.api.transducer;

import com.fstner.application.recognition.EntityRecognitionAppService;
import com.fstner.infrastructure.transducer.TransducerConfiguration;
import com.fstner.interfaces.api.dto.AddStateRequest;
import com.fstner.interfaces.api.dto.AddTransitionRequest;
import com.fstner.interfaces.api.dto.TransducerDescriptionResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Inspection and runtime extension of the active transducer.
 */
@RestController
@RequestMapping("/api/v1/transducer")
@RequiredArgsConstructor
public class TransducerController {

    private final EntityRecognitionAppService recognitionAppService;

    @GetMapping
    public ResponseEntity<TransducerDescriptionResponse> describe() {
        return ResponseEntity.ok(TransducerDescriptionResponse.from(recognitionAppService.currentConfiguration()));
    }

    @PostMapping("/states")
    public ResponseEntity<TransducerDescriptionResponse> addState(@Valid @RequestBody AddStateRequest request) {
        TransducerConfiguration updated = recognitionAppService.addState(request.id());
        return ResponseEntity.status(HttpStatus.CREATED).body(TransducerDescriptionResponse.from(updated));
    }

    @PostMapping("/transitions")
    public ResponseEntity<TransducerDescriptionResponse> addTransition(@Valid @RequestBody AddTransitionRequest request) {
        TransducerConfiguration updated = recognitionAppService.addTransition(
                request.from(), request.pattern(), request.to(), request.label(), request.match());
        return ResponseEntity.status(HttpStatus.CREATED).body(TransducerDescriptionResponse.from(updated));
    }
}
