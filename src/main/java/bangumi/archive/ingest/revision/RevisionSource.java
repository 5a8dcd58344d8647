package bangumi.archive.ingest.revision;

import bangumi.archive.ingest.model.Revision;

import java.time.LocalDate;
import java.util.List;

/**
 * The three operations the loader needs from the archive's revision control.
 * Implementations signal failures with
 * {@link bangumi.archive.ingest.exception.RevisionControlException}.
 */
public interface RevisionSource {

    /**
     * Revisions oldest first, starting at the first one whose snapshot date is on or after
     * {@code startDate} and running to the newest. Empty when none qualifies.
     */
    List<Revision> listRevisionsSince(LocalDate startDate);

    /**
     * Force the working tree to a revision, discarding local modifications.
     */
    void checkout(Revision revision);

    /**
     * Full commit message of a revision; {@link Revision#HEAD} reads the current checkout.
     */
    String readMessage(Revision revision);
}
