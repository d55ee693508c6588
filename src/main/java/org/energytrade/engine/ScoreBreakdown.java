package org.energytrade.engine;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ScoreBreakdown {

    private double priceScore;

    private double trustScore;

    private double timeWindowFitScore;
}
