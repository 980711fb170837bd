package buaa.detect.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 持久化用的匹配对快照
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class MatchSnapshot {

    private BoxSnapshot prediction;
    private BoxSnapshot groundTruth;
    private Double iou;

    public static MatchSnapshot of(Match match) {
        return new MatchSnapshot(
            BoxSnapshot.of(match.getPrediction()),
            BoxSnapshot.of(match.getGroundTruth()),
            match.getIou()
        );
    }
}
