package com.astradesk.reviewtracker.web;

import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import com.astradesk.reviewtracker.analysis.MalformedTimestampException;
import com.astradesk.reviewtracker.service.TicketReviewService;
import com.astradesk.reviewtracker.web.dto.AnalysisResponse;
import com.astradesk.reviewtracker.web.dto.BatchReviewRequest;
import com.astradesk.reviewtracker.web.dto.BatchReviewResponse;
import com.astradesk.reviewtracker.web.dto.HistoryAnalysisRequest;
import com.astradesk.reviewtracker.web.dto.TicketReviewResponse;

import jakarta.validation.Valid;
import reactor.core.publisher.Mono;

/**
 * HTTP API for ticket reviews. A malformed timestamp is the caller's fault when
 * the caller posted the history (400) and Jira's fault otherwise (502).
 */
@RestController
@RequestMapping(path = "/api/reviews", produces = MediaType.APPLICATION_JSON_VALUE)
public class ReviewController {

    private final TicketReviewService reviewService;
    private final ReviewMapper reviewMapper;

    public ReviewController(TicketReviewService reviewService, ReviewMapper reviewMapper) {
        this.reviewService = reviewService;
        this.reviewMapper = reviewMapper;
    }

    @GetMapping("/{issueKey}")
    public Mono<TicketReviewResponse> getReview(@PathVariable String issueKey) {
        return reviewService.review(issueKey)
            .map(reviewMapper::toResponse)
            .onErrorMap(MalformedTimestampException.class,
                ex -> new ResponseStatusException(HttpStatus.BAD_GATEWAY, ex.getMessage(), ex));
    }

    @PostMapping(path = "/batch", consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<BatchReviewResponse> reviewBatch(@Valid @RequestBody BatchReviewRequest request) {
        return reviewService.reviewAll(request.getIssueKeys())
            .collectList()
            .map(reviewMapper::toBatchResponse);
    }

    @PostMapping(path = "/analyze", consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<AnalysisResponse> analyze(@Valid @RequestBody HistoryAnalysisRequest request) {
        return Mono.fromCallable(() -> reviewMapper.toHistory(request))
            .map(reviewService::analyze)
            .map(reviewMapper::toResponse)
            .onErrorMap(MalformedTimestampException.class,
                ex -> new ResponseStatusException(HttpStatus.BAD_REQUEST, ex.getMessage(), ex));
    }
}
