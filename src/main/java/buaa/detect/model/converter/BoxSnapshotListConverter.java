package buaa.detect.model.converter;

import buaa.detect.dto.BoxSnapshot;
import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.persistence.Converter;

import java.util.List;

@Converter
public class BoxSnapshotListConverter extends JsonListConverter<BoxSnapshot> {

    public BoxSnapshotListConverter() {
        super(new TypeReference<List<BoxSnapshot>>() {});
    }
}
