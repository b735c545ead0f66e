package uiscope.quality;

import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Word lists and text filters the scorer uses to recognise actionable,
 * meaningful and stable strings on a screen.
 *
 * <p>The built-in lists are tuned for Chinese and English Android apps; pass a
 * different action vocabulary (e.g. from {@code quality.action.words}) for other
 * locales.
 */
public final class TextVocabulary {

    public static final List<String> DEFAULT_ACTION_WORDS = List.of(
            "确定", "取消", "提交", "保存", "删除", "编辑", "添加", "搜索", "登录", "注册",
            "确认", "重置", "返回", "下一步", "上一步", "完成", "开始", "发送", "关注", "分享",
            "confirm", "cancel", "submit", "ok", "save", "delete", "edit", "add", "search",
            "login", "log in", "sign in", "sign up", "register", "send", "next", "back",
            "done", "start", "follow", "share", "continue");

    private static final List<String> MEANINGFUL_ID_TOKENS = List.of(
            "button", "btn", "input", "search", "edit", "submit", "login", "confirm",
            "cancel", "tab", "nav", "menu", "title", "icon", "avatar", "send", "follow");

    private static final Pattern DIGITS_ONLY  = Pattern.compile("^[\\d\\s.,:+-]+$");
    private static final Pattern SYMBOLS_ONLY = Pattern.compile("^[\\p{P}\\p{S}\\s]+$");

    /** Tab-bar style labels that tend to be unique on a screen. */
    private static final Pattern UNIQUE_PHRASE = Pattern.compile(
            "^(首页|消息|我的?|发现|通讯录|联系人|设置|home|messages?|profile|settings|me|discover|contacts)$",
            Pattern.CASE_INSENSITIVE);

    private final List<String>  actionWords;
    private final List<Pattern> actionPatterns;

    public TextVocabulary() {
        this(DEFAULT_ACTION_WORDS);
    }

    public TextVocabulary(Collection<String> actionWords) {
        this.actionWords = actionWords.stream()
                .filter(w -> w != null && !w.isBlank())
                .map(w -> w.trim().toLowerCase(Locale.ROOT))
                .distinct()
                .toList();
        this.actionPatterns = this.actionWords.stream()
                .map(TextVocabulary::actionPattern)
                .toList();
    }

    public List<String> getActionWords() { return actionWords; }

    /**
     * True if {@code text} contains any action word, case-insensitively. Words
     * written in Han script match anywhere; all others must stand as whole words,
     * so "ok" does not fire inside "Notebook".
     */
    public boolean containsActionWord(String text) {
        if (text == null || text.isBlank()) return false;
        for (Pattern p : actionPatterns) {
            if (p.matcher(text).find()) return true;
        }
        return false;
    }

    private static Pattern actionPattern(String word) {
        int flags = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;
        if (isHan(word)) return Pattern.compile(Pattern.quote(word), flags);
        return Pattern.compile("(?<![\\p{L}\\p{N}])" + Pattern.quote(word) + "(?![\\p{L}\\p{N}])", flags);
    }

    private static boolean isHan(String word) {
        return word.codePoints().anyMatch(cp -> Character.UnicodeScript.of(cp) == Character.UnicodeScript.HAN);
    }

    /**
     * Text worth matching on: between 1 and 100 characters after trimming and not
     * made up only of digits or only of symbols.
     */
    public static boolean isMeaningfulText(String text) {
        if (text == null) return false;
        String t = text.trim();
        if (t.isEmpty() || t.length() > 100) return false;
        return !DIGITS_ONLY.matcher(t).matches() && !SYMBOLS_ONLY.matcher(t).matches();
    }

    /** Resource ids that name their role, e.g. {@code com.app:id/login_btn}. */
    public static boolean isMeaningfulResourceId(String resourceId) {
        if (resourceId == null || resourceId.isBlank()) return false;
        int slash = resourceId.lastIndexOf('/');
        String local = resourceId.substring(slash + 1).toLowerCase(Locale.ROOT);
        for (String token : MEANINGFUL_ID_TOKENS) {
            if (local.contains(token)) return true;
        }
        return false;
    }

    public static boolean isUniquePhrase(String text) {
        return text != null && UNIQUE_PHRASE.matcher(text.trim()).matches();
    }
}
