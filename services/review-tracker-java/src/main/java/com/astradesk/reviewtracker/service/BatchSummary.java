package com.astradesk.reviewtracker.service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.astradesk.reviewtracker.domain.Hours;

/**
 * Aggregate figures over the successful reviews of one batch. Failed tickets
 * are counted but contribute nothing else; averages are per reviewed ticket.
 *
 * @param bounceBackCount all bounce-back events, blocked entries included
 * @param averageStageHours mean hours per configured stage
 */
public record BatchSummary(
    int requested,
    int reviewed,
    int failed,
    long bounceBackCount,
    double averageBounceBacks,
    double hoursLogged,
    Map<String, Double> averageStageHours
) {

    public BatchSummary {
        averageStageHours = Collections.unmodifiableMap(new LinkedHashMap<>(averageStageHours));
    }

    public static BatchSummary of(List<ReviewOutcome> outcomes) {
        List<TicketReview> reviews = outcomes.stream()
            .filter(ReviewOutcome::isSuccess)
            .map(ReviewOutcome::review)
            .toList();

        long bounceBacks = reviews.stream()
            .mapToLong(review -> review.analysis().bounceBacks().size())
            .sum();
        List<Double> logged = new ArrayList<>(reviews.size());
        Map<String, List<Double>> byStage = new LinkedHashMap<>();
        for (TicketReview review : reviews) {
            logged.add(review.hoursLogged());
            review.analysis().stageHours()
                .forEach((stage, hours) -> byStage.computeIfAbsent(stage, s -> new ArrayList<>()).add(hours));
        }

        Map<String, Double> stageAverages = new LinkedHashMap<>();
        byStage.forEach((stage, hours) -> stageAverages.put(stage, Hours.average(Hours.sum(hours), reviews.size())));

        return new BatchSummary(
            outcomes.size(),
            reviews.size(),
            outcomes.size() - reviews.size(),
            bounceBacks,
            Hours.average(bounceBacks, reviews.size()),
            Hours.sum(logged),
            stageAverages);
    }
}
