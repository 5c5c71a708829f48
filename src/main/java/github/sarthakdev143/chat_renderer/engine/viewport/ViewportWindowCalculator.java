package github.sarthakdev143.chat_renderer.engine.viewport;

import java.util.ArrayList;
import java.util.List;

/**
 * Decides which messages fit in the message area. The scrolling video and the paginated
 * screenshots both go through here so they agree on what fits.
 */
public class ViewportWindowCalculator {

    /**
     * Window for a video frame. Content that fits is shown from the first message; otherwise the
     * longest suffix ending at the latest message that fits together with the indicator row.
     * A latest message taller than the viewport is shown alone.
     */
    public ViewportWindow visibleWindow(List<Integer> messageHeights, int indicatorHeight, int viewportHeight) {
        int count = messageHeights.size();
        int total = indicatorHeight;
        for (int height : messageHeights) {
            total += height;
        }

        if (total <= viewportHeight) {
            return new ViewportWindow(0, count, total);
        }

        int used = indicatorHeight;
        int startIndex = count;
        for (int index = count - 1; index >= 0; index--) {
            int height = messageHeights.get(index);
            if (used + height > viewportHeight) {
                break;
            }
            used += height;
            startIndex = index;
        }

        if (startIndex == count && count > 0) {
            startIndex = count - 1;
            used = indicatorHeight + messageHeights.get(startIndex);
        }

        return new ViewportWindow(startIndex, count, used);
    }

    /**
     * Splits every message into consecutive pages with the same cumulative test, scanning forward.
     * No message is split; one taller than the viewport gets a page to itself.
     */
    public List<PageRange> paginate(List<Integer> messageHeights, int viewportHeight) {
        List<PageRange> pages = new ArrayList<>();
        int pageStart = 0;
        int pageHeight = 0;

        for (int index = 0; index < messageHeights.size(); index++) {
            int height = messageHeights.get(index);
            if (index > pageStart && pageHeight + height > viewportHeight) {
                pages.add(new PageRange(pageStart, index, pageHeight));
                pageStart = index;
                pageHeight = 0;
            }
            pageHeight += height;
        }

        if (pageStart < messageHeights.size()) {
            pages.add(new PageRange(pageStart, messageHeights.size(), pageHeight));
        }
        return pages;
    }
}
