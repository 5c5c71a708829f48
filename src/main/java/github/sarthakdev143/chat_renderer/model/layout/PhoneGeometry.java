package github.sarthakdev143.chat_renderer.model.layout;

import github.sarthakdev143.chat_renderer.model.ExportFormat;

/**
 * Phone frame placement and scaled UI constants for one export format.
 * All values are in supersampled pixels; the phone is letterboxed inside the canvas.
 */
public record PhoneGeometry(
        int outputWidth,
        int outputHeight,
        int canvasWidth,
        int canvasHeight,
        int phoneX,
        int phoneY,
        int phoneWidth,
        int phoneHeight,
        double scale,
        boolean groupChat,
        boolean showKeyboard) {

    public static final int SUPERSAMPLE = 2;
    public static final double PHONE_ASPECT_RATIO = 9.0 / 16.0;
    public static final double REFERENCE_WIDTH_POINTS = 390.0;

    public static PhoneGeometry forFormat(ExportFormat format, boolean groupChat, boolean showKeyboard) {
        int canvasWidth = format.width() * SUPERSAMPLE;
        int canvasHeight = format.height() * SUPERSAMPLE;
        double canvasAspect = (double) canvasWidth / canvasHeight;

        int phoneWidth;
        int phoneHeight;
        if (canvasAspect <= PHONE_ASPECT_RATIO) {
            phoneWidth = canvasWidth;
            phoneHeight = (int) (canvasWidth / PHONE_ASPECT_RATIO);
        } else {
            phoneHeight = canvasHeight;
            phoneWidth = (int) (canvasHeight * PHONE_ASPECT_RATIO);
        }

        return new PhoneGeometry(
                format.width(),
                format.height(),
                canvasWidth,
                canvasHeight,
                (canvasWidth - phoneWidth) / 2,
                (canvasHeight - phoneHeight) / 2,
                phoneWidth,
                phoneHeight,
                phoneWidth / REFERENCE_WIDTH_POINTS,
                groupChat,
                showKeyboard);
    }

    public int px(double points) {
        return (int) (points * scale);
    }

    public int headerHeight() {
        return groupChat ? px(50) : px(120);
    }

    public int keyboardHeight() {
        return px(216);
    }

    public int inputBarHeight() {
        return px(52);
    }

    public int keyboardTop() {
        return phoneHeight - keyboardHeight();
    }

    public int messageAreaTop() {
        return headerHeight() + px(10);
    }

    public int messageAreaBottom() {
        if (showKeyboard) {
            return keyboardTop() - inputBarHeight() - px(10);
        }
        return phoneHeight - px(20);
    }

    public int viewportHeight() {
        return messageAreaBottom() - messageAreaTop();
    }

    public int maxBubbleWidth() {
        return (int) (phoneWidth * 0.70);
    }

    public int maxTextWidth() {
        return maxBubbleWidth() - textHorizontalPadding();
    }

    public int textHorizontalPadding() {
        return px(24);
    }

    public int bubbleVerticalPadding() {
        return px(14);
    }

    public int lineHeight() {
        return px(22);
    }

    public int messageSpacing() {
        return px(8);
    }

    public int nameRowHeight() {
        return px(18);
    }

    public int typingIndicatorRowHeight() {
        return px(50);
    }

    public int bubbleSidePadding() {
        return px(16);
    }

    public int avatarSize() {
        return px(28);
    }

    public int avatarMargin() {
        return px(6);
    }

    public int bubbleRadius() {
        return px(18);
    }

    public int tailSize() {
        return px(8);
    }

    public int fontSize() {
        return px(17);
    }

    public int nameFontSize() {
        return px(12);
    }
}
