package at.totenbilder.search.repository;

import at.totenbilder.search.model.ImageRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

/**
 * Read access to the image metadata table
 */
@Repository
public interface ImageRecordRepository extends JpaRepository<ImageRecord, String> {

    /**
     * All filenames as stored, with or without prefix
     */
    @Query("select r.filename from ImageRecord r")
    List<String> findAllFilenames();

    /**
     * Rows matching any of the given spellings of a filename
     */
    List<ImageRecord> findByFilenameIn(Collection<String> filenames);
}
