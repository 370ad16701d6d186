package com.openforge.gazetranslate.orchestration;

import com.openforge.gazetranslate.error.ValidationException;
import com.openforge.gazetranslate.memory.CaptureContext;
import com.openforge.gazetranslate.memory.LanguagePair;
import com.openforge.gazetranslate.memory.MemoryController;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;

/**
 * Memory-gated translation without a gaze session.
 *
 * Endpoints:
 *   POST /api/translate/text      JSON {source_text, source_lang, target_lang}
 *   POST /api/translate/image     multipart "image" + source_lang / target_lang params
 *
 * A FAILED outcome is returned with the HTTP status of its error code.
 */
@RestController
@RequestMapping("/api/translate")
@RequiredArgsConstructor
public class TranslateController {

    private final TranslationOrchestrator orchestrator;

    @PostMapping("/text")
    public ResponseEntity<TranslationOutcome> translateText(
            @RequestHeader(MemoryController.OWNER_HEADER) String ownerId,
            @Valid @RequestBody TextRequest req) {
        LanguagePair languages = LanguagePair.of(req.sourceLang(), req.targetLang());
        TranslationOutcome outcome = orchestrator.translateText(ownerId, req.sourceText().strip(), languages,
                CaptureContext.manual());
        return respond(outcome);
    }

    @PostMapping(path = "/image", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<TranslationOutcome> translateImage(
            @RequestHeader(MemoryController.OWNER_HEADER) String ownerId,
            @RequestPart("image") MultipartFile image,
            @RequestParam(name = "source_lang", defaultValue = LanguagePair.AUTO) String sourceLang,
            @RequestParam(name = "target_lang") String targetLang) {
        byte[] bytes;
        try {
            bytes = image.getBytes();
        } catch (IOException e) {
            throw new ValidationException("Could not read uploaded image");
        }
        CaptureRequest request = new CaptureRequest(ownerId, bytes, LanguagePair.of(sourceLang, targetLang),
                null, null, null);
        return respond(orchestrator.translateImage(request));
    }

    private static ResponseEntity<TranslationOutcome> respond(TranslationOutcome outcome) {
        if (outcome.status() == TranslationOutcome.Status.FAILED && outcome.errorCode() != null) {
            return ResponseEntity.status(outcome.errorCode().status()).body(outcome);
        }
        return ResponseEntity.ok(outcome);
    }

    public record TextRequest(
            @NotBlank @Size(max = 5000) String sourceText,
            @NotBlank String sourceLang,
            @NotBlank String targetLang
    ) {}
}
