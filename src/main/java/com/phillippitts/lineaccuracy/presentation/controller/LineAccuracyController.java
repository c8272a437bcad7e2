package com.phillippitts.lineaccuracy.presentation.controller;

import com.phillippitts.lineaccuracy.config.accuracy.AccuracyProperties;
import com.phillippitts.lineaccuracy.domain.AccuracyResult;
import com.phillippitts.lineaccuracy.domain.LockedWordState;
import com.phillippitts.lineaccuracy.domain.RealtimeMatch;
import com.phillippitts.lineaccuracy.domain.SubsequenceMatchResult;
import com.phillippitts.lineaccuracy.domain.WordByWordResult;
import com.phillippitts.lineaccuracy.presentation.dto.LineCheckRequest;
import com.phillippitts.lineaccuracy.presentation.dto.LockedMatchRequest;
import com.phillippitts.lineaccuracy.presentation.dto.LockedMatchResponse;
import com.phillippitts.lineaccuracy.presentation.dto.SegmentRequest;
import com.phillippitts.lineaccuracy.presentation.dto.SegmentResponse;
import com.phillippitts.lineaccuracy.service.LineAccuracyService;
import com.phillippitts.lineaccuracy.service.match.KnownNames;
import com.phillippitts.lineaccuracy.service.text.LineSegmenter;
import jakarta.validation.Valid;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.List;

/**
 * JSON endpoints for scoring and live-matching spoken lines.
 *
 * <p>Live matching is stateless on the server: the client posts back the {@link LockedWordState}
 * it received from the previous call.
 */
@RestController
@RequestMapping("/api/accuracy")
class LineAccuracyController {

    private static final Logger log = LogManager.getLogger(LineAccuracyController.class);

    private final LineAccuracyService service;
    private final AccuracyProperties props;

    LineAccuracyController(LineAccuracyService service, AccuracyProperties props) {
        this.service = service;
        this.props = props;
    }

    @PostMapping("/check")
    ResponseEntity<AccuracyResult> check(@Valid @RequestBody LineCheckRequest req) {
        boolean strict = req.strict() == null ? props.isStrictByDefault() : req.strict();
        AccuracyResult result = service.checkAccuracy(req.expected(), req.spoken(), strict,
                knownNames(req.knownNames(), req.characterNames()));
        log.info("Line checked: correct={}, accuracy={}, strict={}", result.correct(), result.accuracy(), strict);
        return ResponseEntity.ok(result);
    }

    @PostMapping("/realtime")
    ResponseEntity<RealtimeMatch> realtime(@Valid @RequestBody LineCheckRequest req) {
        return ResponseEntity.ok(service.getRealtimeWordMatch(req.expected(), req.spoken(),
                knownNames(req.knownNames(), req.characterNames())));
    }

    @PostMapping("/locked")
    ResponseEntity<LockedMatchResponse> locked(@Valid @RequestBody LockedMatchRequest req) {
        LockedWordState state = service.getLockedWordMatch(req.expected(), req.spoken(), req.previous(),
                knownNames(req.knownNames(), req.characterNames()));
        return ResponseEntity.ok(new LockedMatchResponse(state, service.isLineComplete(req.expected(), state)));
    }

    @GetMapping("/locked/fresh")
    ResponseEntity<LockedWordState> freshLockedState() {
        return ResponseEntity.ok(service.createFreshLockedState());
    }

    @PostMapping("/subsequence")
    ResponseEntity<SubsequenceMatchResult> subsequence(@Valid @RequestBody LineCheckRequest req) {
        return ResponseEntity.ok(service.getSubsequenceWordMatch(req.expected(), req.spoken(),
                knownNames(req.knownNames(), req.characterNames())));
    }

    @PostMapping("/word-by-word")
    ResponseEntity<WordByWordResult> wordByWord(@Valid @RequestBody LineCheckRequest req) {
        return ResponseEntity.ok(service.getWordByWordResults(req.expected(), req.spoken(),
                knownNames(req.knownNames(), req.characterNames())));
    }

    @PostMapping("/segments")
    ResponseEntity<SegmentResponse> segments(@Valid @RequestBody SegmentRequest req) {
        List<String> segments = LineSegmenter.segment(req.line(), req.practiceSegments());
        List<String> accumulated = new ArrayList<>(segments.size());
        for (int i = 0; i < segments.size(); i++) {
            accumulated.add(LineSegmenter.accumulated(segments, i));
        }
        return ResponseEntity.ok(new SegmentResponse(segments, accumulated));
    }

    private static KnownNames knownNames(List<String> knownNames, List<String> characterNames) {
        return KnownNames.of(knownNames).union(KnownNames.fromCharacterNames(characterNames));
    }
}
