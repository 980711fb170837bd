package buaa.detect.model.converter;

import buaa.detect.dto.MatchSnapshot;
import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.persistence.Converter;

import java.util.List;

@Converter
public class MatchSnapshotListConverter extends JsonListConverter<MatchSnapshot> {

    public MatchSnapshotListConverter() {
        super(new TypeReference<List<MatchSnapshot>>() {});
    }
}
