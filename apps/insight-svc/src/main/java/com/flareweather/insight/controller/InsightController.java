package com.flareweather.insight.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.flareweather.insight.controller.dto.DailyInsightRequestDto;
import com.flareweather.insight.controller.dto.DailyInsightResponseDto;
import com.flareweather.insight.controller.dto.WeeklyInsightRequestDto;
import com.flareweather.insight.controller.dto.WeeklyInsightResponseDto;
import com.flareweather.insight.daily.DailyInsightFormatter;
import com.flareweather.insight.model.FormattedWeeklyInsight;
import com.flareweather.insight.web.RequestContextHolder;
import com.flareweather.insight.weekly.WeeklyInsightFormatter;
import jakarta.validation.Valid;
import java.time.Clock;
import java.time.LocalDate;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/insights")
@Validated
public class InsightController {

    private final DailyInsightFormatter dailyInsightFormatter;
    private final WeeklyInsightFormatter weeklyInsightFormatter;
    private final Clock clock;

    public InsightController(DailyInsightFormatter dailyInsightFormatter,
                             WeeklyInsightFormatter weeklyInsightFormatter,
                             Clock clock) {
        this.dailyInsightFormatter = dailyInsightFormatter;
        this.weeklyInsightFormatter = weeklyInsightFormatter;
        this.clock = clock;
    }

    @PostMapping("/daily")
    public ResponseEntity<DailyInsightResponseDto> daily(@RequestBody DailyInsightRequestDto request) {
        String message = dailyInsightFormatter.format(rawPayload(request.payload()), request.why());
        return ResponseEntity.ok(new DailyInsightResponseDto(message, traceId()));
    }

    @PostMapping("/weekly")
    public ResponseEntity<WeeklyInsightResponseDto> weekly(@Valid @RequestBody WeeklyInsightRequestDto request) {
        // captured once so all seven labels agree
        LocalDate referenceDate = request.referenceDate() == null || request.referenceDate().isBlank()
                ? LocalDate.now(clock)
                : LocalDate.parse(request.referenceDate());
        FormattedWeeklyInsight insight = weeklyInsightFormatter.format(rawPayload(request.payload()), referenceDate);
        return ResponseEntity.ok(WeeklyInsightResponseDto.from(insight, traceId()));
    }

    static String rawPayload(JsonNode payload) {
        if (payload == null || payload.isNull() || payload.isMissingNode()) {
            return null;
        }
        return payload.isTextual() ? payload.asText() : payload.toString();
    }

    private static String traceId() {
        return RequestContextHolder.traceId().orElse(null);
    }
}
