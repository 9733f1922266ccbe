package com.wagesearch.salary.pipeline;

import com.wagesearch.salary.model.CompensationRecord;
import com.wagesearch.salary.model.RawRow;
import com.wagesearch.salary.model.ValidationOutcome;
import com.wagesearch.salary.normalize.FieldNormalizer;
import com.wagesearch.salary.normalize.RecordValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

@Component
public class NormalizationPipeline {
    private static final Logger log = LoggerFactory.getLogger(NormalizationPipeline.class);

    private final FieldNormalizer fieldNormalizer;
    private final RecordValidator recordValidator;

    public NormalizationPipeline(FieldNormalizer fieldNormalizer, RecordValidator recordValidator) {
        this.fieldNormalizer = fieldNormalizer;
        this.recordValidator = recordValidator;
    }

    /**
     * Lazily turns the source's rows into canonical records. Rejected rows are dropped and
     * counted in {@code tally}; they never end the stream. The caller closes the stream.
     */
    public Stream<CompensationRecord> normalize(RawRecordSource source, NormalizationTally tally) throws IOException {
        return source.rows()
            .map(row -> process(row, tally))
            .filter(ValidationOutcome::isAccepted)
            .map(ValidationOutcome::record);
    }

    public List<CompensationRecord> normalizeAll(RawRecordSource source, NormalizationTally tally) throws IOException {
        try (Stream<CompensationRecord> records = normalize(source, tally)) {
            return records.collect(Collectors.toList());
        }
    }

    private ValidationOutcome process(RawRow row, NormalizationTally tally) {
        tally.rowRead();
        ValidationOutcome outcome = recordValidator.validate(fieldNormalizer.extract(row));
        if (!outcome.isAccepted()) {
            tally.rejected(row.rowNumber(), outcome.rejection());
            log.debug("Row {} rejected: {}", row.rowNumber(), outcome.rejection());
        } else if (outcome.unitCorrected()) {
            tally.unitCorrected();
            log.debug("Row {} pay unit corrected to {}", row.rowNumber(), outcome.record().payUnit());
        }
        return outcome;
    }
}
