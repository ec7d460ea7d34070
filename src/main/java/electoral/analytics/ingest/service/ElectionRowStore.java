package electoral.analytics.ingest.service;

import electoral.analytics.ingest.model.ElectionResultRow;
import electoral.analytics.ingest.repository.ElectionResultRowRepository;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;

/**
 * Writes typed rows to the row store with natural-key deduplication.
 */
@Component
public class ElectionRowStore {

    @Autowired
    private ElectionResultRowRepository rowRepository;

    /**
     * Insert a row unless a row with the same natural key already exists.
     *
     * @return true if inserted, false if the key was already present
     */
    public boolean insertIfAbsent(ElectionResultRow row) {
        if (rowRepository.existsByNaturalKey(row.getNaturalKey())) {
            return false;
        }
        try {
            rowRepository.save(row);
            return true;
        } catch (DataIntegrityViolationException e) {
            // lost a race on the unique key; anything else is a real storage failure
            if (rowRepository.existsByNaturalKey(row.getNaturalKey())) {
                return false;
            }
            throw e;
        }
    }
}
