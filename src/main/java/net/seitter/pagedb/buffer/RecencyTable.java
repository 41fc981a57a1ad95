package net.seitter.pagedb.buffer;

import net.seitter.pagedb.storage.PageId;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * The used list and the page index of the buffer pool as a single structure.
 * Frames are kept in recency order (head = most recently touched) and are
 * found by identity in O(1). An identity is indexed if and only if its frame
 * is linked into the list.
 */
class RecencyTable {
    private final Map<PageId, BufferFrame> index = new HashMap<>();
    private BufferFrame head;
    private BufferFrame tail;

    BufferFrame get(PageId pageId) {
        return index.get(pageId);
    }

    boolean contains(PageId pageId) {
        return index.containsKey(pageId);
    }

    int size() {
        return index.size();
    }

    BufferFrame head() {
        return head;
    }

    BufferFrame tail() {
        return tail;
    }

    /**
     * Links a bound frame as the new head and indexes its identity.
     */
    void insertAtHead(BufferFrame frame) {
        PageId pageId = frame.getPageId();
        if (pageId == null) {
            throw new IllegalStateException("Cannot link a frame without a page identity");
        }
        if (index.putIfAbsent(pageId, frame) != null) {
            throw new IllegalStateException("Page " + pageId + " is already resident");
        }
        linkHead(frame);
    }

    /**
     * Makes a resident frame the most recently touched one.
     */
    void moveToHead(BufferFrame frame) {
        if (head == frame) {
            return;
        }
        unlink(frame);
        linkHead(frame);
    }

    /**
     * Unlinks a resident frame and drops its identity from the index.
     */
    void remove(BufferFrame frame) {
        if (index.remove(frame.getPageId()) != frame) {
            throw new IllegalStateException("Frame " + frame + " is not resident");
        }
        unlink(frame);
    }

    /**
     * Finds the first unfixed frame in victim order.
     *
     * @param policy LRU scans from the tail, MRU from the head
     * @return The victim, or null if every frame is fixed
     */
    BufferFrame findUnfixed(ReplacementPolicy policy) {
        if (policy == ReplacementPolicy.MRU) {
            for (BufferFrame frame = head; frame != null; frame = frame.next) {
                if (!frame.isFixed()) {
                    return frame;
                }
            }
        } else {
            for (BufferFrame frame = tail; frame != null; frame = frame.prev) {
                if (!frame.isFixed()) {
                    return frame;
                }
            }
        }
        return null;
    }

    /**
     * Gets the resident frames of one file, head first.
     */
    List<BufferFrame> framesOf(int fileId) {
        List<BufferFrame> frames = new ArrayList<>();
        for (BufferFrame frame = head; frame != null; frame = frame.next) {
            if (frame.getPageId().getFileId() == fileId) {
                frames.add(frame);
            }
        }
        return frames;
    }

    /**
     * Gets all resident frames, head first.
     */
    List<BufferFrame> frames() {
        List<BufferFrame> frames = new ArrayList<>(index.size());
        for (BufferFrame frame = head; frame != null; frame = frame.next) {
            frames.add(frame);
        }
        return frames;
    }

    void clear() {
        for (BufferFrame frame : frames()) {
            frame.reset();
        }
        index.clear();
        head = null;
        tail = null;
    }

    /**
     * Verifies that the links and the index describe the same set of frames.
     *
     * @throws IllegalStateException If they disagree
     */
    void checkConsistency() {
        int linked = 0;
        BufferFrame previous = null;
        for (BufferFrame frame = head; frame != null; frame = frame.next) {
            if (frame.prev != previous) {
                throw new IllegalStateException("Broken back link at " + frame);
            }
            if (index.get(frame.getPageId()) != frame) {
                throw new IllegalStateException("Linked frame " + frame + " is not indexed");
            }
            if (frame.isFixed() && frame.getFile() == null) {
                throw new IllegalStateException("Fixed frame " + frame + " has no owning file");
            }
            previous = frame;
            linked++;
        }
        if (previous != tail) {
            throw new IllegalStateException("Tail does not end the used list");
        }
        if (linked != index.size()) {
            throw new IllegalStateException("Used list holds " + linked + " frames but the index holds "
                    + index.size());
        }
    }

    private void linkHead(BufferFrame frame) {
        frame.prev = null;
        frame.next = head;
        if (head != null) {
            head.prev = frame;
        }
        head = frame;
        if (tail == null) {
            tail = frame;
        }
    }

    private void unlink(BufferFrame frame) {
        if (head == frame) {
            head = frame.next;
        }
        if (tail == frame) {
            tail = frame.prev;
        }
        if (frame.next != null) {
            frame.next.prev = frame.prev;
        }
        if (frame.prev != null) {
            frame.prev.next = frame.next;
        }
        frame.prev = null;
        frame.next = null;
    }
}
