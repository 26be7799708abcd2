package de.jwiegmann.archive.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DetectedFace {
    private List<Double> bbox;   // x1, y1, x2, y2
    private double confidence;
}
