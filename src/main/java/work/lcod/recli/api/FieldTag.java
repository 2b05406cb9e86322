package work.lcod.recli.api;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Repeatable;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Name/value metadata attached to a record field.
 *
 * <p>The value may hold several comma separated entries ({@code @FieldTag(name = "recli", value = "id,-")});
 * a {@link TagSpec} matches when its value equals one of them. Which names carry the skip, id, usage and
 * default roles is decided by {@link RecliConfiguration}.
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.FIELD)
@Repeatable(FieldTags.class)
public @interface FieldTag {
    String name();

    String value();
}
