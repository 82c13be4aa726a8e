/**
 * OutputBuffer.java
 *
 * 一个线程安全、只追加的有界文本缓冲区，用于捕获运行中进程的输出。
 * 缓冲区长度永远不会超过配置的容量：超出容量的追加会被截断，并以一条截断提示代替，
 * 此后的追加只计数、不写入，直到读取方通过 drain() 取走内容。
 */
package club.ppmc.ideabridge.core;

public class OutputBuffer {

    public static final String TRUNCATION_NOTICE = "\n... [output truncated]";

    private final int capacity;
    private final StringBuilder content = new StringBuilder();
    private boolean truncated;
    private long droppedCharacters;

    /**
     * @param capacity 最大字符数，包含截断提示本身，必须大于截断提示的长度。
     */
    public OutputBuffer(int capacity) {
        if (capacity <= TRUNCATION_NOTICE.length()) {
            throw new IllegalArgumentException(
                    "输出缓冲区容量必须大于截断提示长度 " + TRUNCATION_NOTICE.length() + "，实际为 " + capacity);
        }
        this.capacity = capacity;
    }

    public synchronized void append(String text) {
        if (text == null || text.isEmpty()) {
            return;
        }
        if (truncated) {
            droppedCharacters += text.length();
            return;
        }
        // 为截断提示预留空间，保证截断后长度仍不超过容量
        int room = capacity - TRUNCATION_NOTICE.length() - content.length();
        if (text.length() <= room) {
            content.append(text);
            return;
        }
        int kept = Math.max(room, 0);
        content.append(text, 0, kept).append(TRUNCATION_NOTICE);
        droppedCharacters += text.length() - kept;
        truncated = true;
    }

    public synchronized String read() {
        return content.toString();
    }

    /**
     * 原子地取走当前全部内容并清空缓冲区。清空后缓冲区重新接受追加。
     */
    public synchronized String drain() {
        String drained = content.toString();
        content.setLength(0);
        truncated = false;
        return drained;
    }

    public synchronized int length() {
        return content.length();
    }

    public synchronized boolean isTruncated() {
        return truncated;
    }

    public synchronized long droppedCharacters() {
        return droppedCharacters;
    }

    public int capacity() {
        return capacity;
    }
}
