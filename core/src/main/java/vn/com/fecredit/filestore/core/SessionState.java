package vn.com.fecredit.filestore.core;

/**
 * Lifecycle of an upload session.
 *
 * <pre>
 * OPEN --(finish)--&gt; FINALIZING --(merge ok)--&gt; CLOSED
 *                        |
 *                        +--(merge failed)--&gt; OPEN
 * OPEN --(abort | idle reap)--&gt; CLOSED
 * </pre>
 * Nothing leaves {@code CLOSED}.
 */
public enum SessionState {
    OPEN,
    FINALIZING,
    CLOSED
}
