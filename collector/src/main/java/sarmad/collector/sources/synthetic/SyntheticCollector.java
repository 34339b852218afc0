package sarmad.collector.sources.synthetic;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sarmad.collector.config.CollectorConfig;
import sarmad.collector.core.PlatformCollector;
import sarmad.collector.model.RawRecord;
import sarmad.collector.model.RawRecord.Author;
import sarmad.collector.model.RawRecord.Media;
import sarmad.collector.sink.RecordSink;
import sarmad.collector.util.TimeUtil;

import java.time.Instant;
import java.util.*;

/**
 * Reproducible viral event: one video post, a handful of early adopters (mostly replies),
 * a burst that peaks two to six hours later, a long tail, and unrelated chatter over the
 * whole day. Same seed and base give the same records.
 *
 * <p>Phase timings, in minutes after {@code base}:
 * <ul>
 *   <li>source: 15, carries a video</li>
 *   <li>early (5%): normal around 60, clamped to 20..115; 60% reply in the source's thread</li>
 *   <li>viral (80%): 120 + lognormal(2.5, 0.7) * 30, clamped to 120..360</li>
 *   <li>tail (15%): 360 + exponential(rate 0.01), capped at 1440</li>
 *   <li>daily: uniform 0..1440, 15% with a photo</li>
 * </ul>
 */
public class SyntheticCollector implements PlatformCollector {
    private static final Logger log = LoggerFactory.getLogger(SyntheticCollector.class);

    static final String SOURCE_TEXT = "اللي صار قدام مدرسة {location} اليوم 😳🔥 المقطع كامل";

    static final List<String> KEYWORD_TEMPLATES = List.of(
            "مضاربة قوية في {location} قدام المدرسة والشرطة وصلت",
            "احد عنده المقطع الكامل حق مضاربة {location}؟",
            "وش سالفة المضاربة اللي في {location}",
            "المقطع منتشر في كل القروبات، مضاربة عند مدرسة {location}",
            "الشرطة لازم تتدخل، مضاربة ثانية في شوارع {location}",
            "شفت فيديو المضاربة؟ {location} صارت ترند",
            "عنف قدام المدرسة في {location} وين الرقابة",
            "مشاجرة طلاب في {location} والمقطع انتشر بسرعة",
            "ضرب وسلاح ابيض؟ مضاربة {location} ما هي طبيعية",
            "لا تنشرون فيديو مضاربة {location} فيه قاصرين",
            "اهل {location} يقولون المضاربة صارت بعد الدوام",
            "هذي ثالث مضاربة في {location} هالشهر"
    );

    static final List<String> NOISE_TEMPLATES = List.of(
            "الهلال والنصر الليلة، مين بيفوز؟",
            "عروض نهاية الموسم بدت، تخفيضات في كل مكان",
            "حفلة الليلة في الرياض زحمة مرة",
            "مباراة اليوم تجنن ما تنفوت",
            "وش افضل مطعم جديد في الرياض؟",
            "الجو حار مرة اليوم",
            "تخفيضات الجوالات وصلت لين خمسين بالمية",
            "موسم الرياض هالسنة غير"
    );

    static final List<String> REPLY_TEMPLATES = List.of(
            "وين صار هذا؟",
            "الله يستر، متى صار؟",
            "احد يعرف الشباب اللي بالمقطع؟",
            "هذا عند المدرسة صح؟",
            "لازم تنبلغ الجهات المختصة",
            "منشن الشرطة",
            "ارسلته للقروب",
            "حسبي الله، وش ذا"
    );

    static final List<String> DAILY_TEMPLATES = List.of(
            "صباح الخير يا جماعة ☀️",
            "قهوة الصباح ضرورية",
            "الدوام اليوم طويل",
            "احد جرب الكافيه الجديد؟",
            "الزحمة في طريق الملك فهد ما تنطاق",
            "اجمل غروب شفته هالاسبوع",
            "متى الاجازة الجاية؟",
            "كتاب جديد بديت اقراه اليوم",
            "مين يتابع المسلسل الجديد؟",
            "الحمد لله على كل حال",
            "اليوم رياضة ساعة كاملة 💪",
            "عشاء عائلي الليلة",
            "توصيات لجوال جديد؟",
            "سفرة الويكند وين تنصحون؟",
            "مساء الورد"
    );

    static final List<String> DISPLAY_NAMES = List.of(
            "ابو فهد", "نوره", "سلطان ⚡", "ريم ✨", "محمد | ينبع", "غلا", "عبدالله", "لمى",
            "Khalid", "Sara 🌙", "ابو ناصر", "شهد", "تركي", "Joud", "مشاري", "هيا"
    );

    static final List<String> USERNAME_BASES = List.of(
            "fahad", "noura", "sultan", "reem", "abood", "lama", "khalid", "sara",
            "turki", "joud", "mishari", "haya", "ksa_voice", "riyadh_life", "night_owl", "gamer"
    );

    static final String VIDEO_URL = "https://video.example.com/clip.mp4";
    static final String PHOTO_URL = "https://picsum.photos/600/400";

    @Override public String id() { return "synthetic"; }

    @Override
    public void collect(CollectorConfig cfg, RecordSink sink) throws Exception {
        List<RawRecord> records = generate(cfg);
        for (RawRecord r : records) sink.accept(r);
        log.info("generated {} records (event={}, seed={})", records.size(), cfg.includeEvent, cfg.seed);
    }

    /** Records sorted by creation time, then id. */
    public List<RawRecord> generate(CollectorConfig cfg) {
        Gen g = new Gen(new Random(cfg.seed));
        Instant base = cfg.base;
        String location = cfg.location;
        List<RawRecord> out = new ArrayList<>();

        if (cfg.includeEvent) {
            Author sourceAuthor = g.author();
            String sourceId = g.postId();
            RawRecord source = new RawRecord(sourceId, sourceId, sourceAuthor, fill(SOURCE_TEXT, location),
                    TimeUtil.plusMinutes(base, 15), List.of(new Media("video", "vid_" + g.hex8(), VIDEO_URL)),
                    true, null, null);
            out.add(source);

            int early = (int) (cfg.eventPosts * 0.05);
            int viral = (int) (cfg.eventPosts * 0.80);
            int tail = (int) (cfg.eventPosts * 0.15);

            for (int i = 0; i < early; i++) {
                double minutes = clamp(g.gaussian(60, 20), 20, 115);
                Instant at = TimeUtil.plusMinutes(base, minutes);
                if (g.chance(0.6)) {
                    out.add(new RawRecord(g.postId(), sourceId, g.author(), g.pick(REPLY_TEMPLATES), at,
                            null, false, "reply", sourceAuthor.id));
                } else {
                    out.add(plain(g, fill(g.pick(KEYWORD_TEMPLATES), location), at));
                }
            }

            for (int i = 0; i < viral; i++) {
                double minutes = clamp(120 + g.logNormal(2.5, 0.7) * 30, 120, 360);
                String text;
                if (g.chance(0.7)) {
                    text = fill(g.pick(KEYWORD_TEMPLATES), location);
                    if (g.chance(0.3)) text += " #مضاربة_" + location.replace(' ', '_');
                } else {
                    text = g.pick(NOISE_TEMPLATES);
                    if (g.chance(0.5)) text += " #ترند_الرياض";
                }
                out.add(plain(g, text, TimeUtil.plusMinutes(base, minutes)));
            }

            for (int i = 0; i < tail; i++) {
                double minutes = Math.min(360 + g.exponential(0.01), 1440);
                String text = g.chance(0.5) ? fill(g.pick(KEYWORD_TEMPLATES), location) : g.pick(NOISE_TEMPLATES);
                out.add(plain(g, text, TimeUtil.plusMinutes(base, minutes)));
            }
        }

        for (int i = 0; i < cfg.dailyPosts; i++) {
            Instant at = TimeUtil.plusMinutes(base, g.uniform(0, 1440));
            String id = g.postId();
            List<Media> media = g.chance(0.15) ? List.of(new Media("photo", "img_" + g.hex8(), PHOTO_URL)) : null;
            out.add(new RawRecord(id, id, g.author(), g.pick(DAILY_TEMPLATES), at, media, false, null, null));
        }

        out.sort(Comparator.comparing((RawRecord r) -> r.createdAt).thenComparing(r -> r.id));
        return out;
    }

    private static RawRecord plain(Gen g, String text, Instant at) {
        String id = g.postId();
        return new RawRecord(id, id, g.author(), text, at, null, false, null, null);
    }

    static String fill(String template, String location) {
        return template.replace("{location}", location);
    }

    private static double clamp(double v, double lo, double hi) {
        return Math.max(lo, Math.min(hi, v));
    }

    /** Random draws and identifiers, all from one seeded source. */
    private static final class Gen {
        private static final long ID_FLOOR = 1_700_000_000_000_000_000L;
        private static final long ID_SPAN = 99_999_999_999_999_999L;

        private final Random rnd;
        private final Set<String> usedIds = new HashSet<>();

        Gen(Random rnd) { this.rnd = rnd; }

        String postId() {
            String id;
            do {
                id = Long.toString(ID_FLOOR + (long) (rnd.nextDouble() * ID_SPAN));
            } while (!usedIds.add(id));
            return id;
        }

        Author author() {
            String userId = Long.toString(100_000_000L + (long) (rnd.nextDouble() * 9_900_000_000L));
            String username = pick(USERNAME_BASES) + (chance(0.5) ? "_" + (1 + rnd.nextInt(999)) : "");
            return new Author(userId, username, pick(DISPLAY_NAMES));
        }

        String hex8() { return String.format("%08x", rnd.nextInt()); }

        <T> T pick(List<T> xs) { return xs.get(rnd.nextInt(xs.size())); }
        boolean chance(double p) { return rnd.nextDouble() < p; }
        double uniform(double lo, double hi) { return lo + rnd.nextDouble() * (hi - lo); }
        double gaussian(double mean, double sd) { return mean + rnd.nextGaussian() * sd; }
        double logNormal(double mu, double sigma) { return Math.exp(mu + sigma * rnd.nextGaussian()); }
        double exponential(double rate) { return -Math.log(1.0 - rnd.nextDouble()) / rate; }
    }
}
