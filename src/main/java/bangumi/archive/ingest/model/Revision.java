package bangumi.archive.ingest.model;

import lombok.Value;

/**
 * An addressable revision of the archive checkout.
 */
@Value
public class Revision {

    /** The revision currently checked out */
    public static final Revision HEAD = new Revision("HEAD", "");

    /** Commit hash or ref name */
    String id;

    /** Commit subject line as listed; may be empty */
    String subject;

    public String getShortId() {
        return id.length() > 10 ? id.substring(0, 10) : id;
    }
}
