package io.github.yok.blogvault.registry;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import lombok.Generated;

/**
 * Read-only catalogs of canonical names and their legacy spellings.
 *
 * <p>
 * All collections are immutable and built once at class initialization.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public final class AliasTables {

    /**
     * Canonical tables in export and restore order.
     */
    public static final ImmutableList<String> TABLES = ImmutableList.of("users", "user_sessions",
            "api_tokens", "oauth2_tokens", "authn_credentials", "readers", "categories", "topics",
            "posts", "notes", "pages", "comments", "recentlies", "drafts", "draft_histories",
            "ai_summaries", "ai_deep_readings", "analyzes", "activities", "slug_trackers",
            "file_references", "webhooks", "webhook_events", "snippets", "projects", "links",
            "says", "subscribes", "meta_presets", "serverless_storages", "options");

    /**
     * Legacy collection names mapped to canonical tables.
     */
    public static final ImmutableMap<String, String> TABLE_ALIASES =
            ImmutableMap.<String, String>builder()
                    .put("metapresets", "meta_presets")
                    .put("sessions", "user_sessions")
                    .put("serverlessstorages", "serverless_storages")
                    .put("authns", "authn_credentials")
                    .put("analyze_logs", "analyzes")
                    .put("recently", "recentlies")
                    .put("subscribers", "subscribes")
                    .build();

    /**
     * Field names mapped to columns for every table.
     */
    public static final ImmutableMap<String, String> COLUMN_ALIASES =
            ImmutableMap.<String, String>builder()
                    .put("_id", "id")
                    .put("created", "created_at")
                    .put("modified", "updated_at")
                    .put("createdat", "created_at")
                    .put("updatedat", "updated_at")
                    .put("userid", "user_id")
                    .put("ipaddress", "ip")
                    .put("useragent", "ua")
                    .put("reftype", "ref_type")
                    .put("refid", "ref_id")
                    .put("ref", "ref_id")
                    .put("parent", "parent_id")
                    .put("targetid", "target_id")
                    .put("commentsindex", "comments_index")
                    .put("iswhispers", "is_whispers")
                    .put("parentid", "parent_id")
                    .put("readerid", "reader_id")
                    .put("publicat", "public_at")
                    .put("topicid", "topic_id")
                    .put("categoryid", "category_id")
                    .put("pinorder", "pin_order")
                    .put("readcount", "read_count")
                    .put("likecount", "like_count")
                    .put("nid", "n_id")
                    .build();

    /**
     * Per-table overrides, checked before {@link #COLUMN_ALIASES}.
     */
    public static final ImmutableMap<String, ImmutableMap<String, String>> COLUMN_ALIASES_BY_TABLE =
            ImmutableMap.of("notes", ImmutableMap.of("password", "password_hash"));

    /**
     * Reference-type spellings mapped to the current singular term.
     */
    public static final ImmutableMap<String, String> REF_TYPE_ALIASES =
            ImmutableMap.<String, String>builder()
                    .put("posts", "post")
                    .put("post", "post")
                    .put("notes", "note")
                    .put("note", "note")
                    .put("pages", "page")
                    .put("page", "page")
                    .put("recently", "recently")
                    .put("recentlies", "recently")
                    .build();

    /**
     * Legacy standalone option names (squashed, lower-case) mapped to unified config sections.
     */
    public static final ImmutableMap<String, String> LEGACY_OPTION_SECTIONS =
            ImmutableMap.<String, String>builder()
                    .put("seo", "seo")
                    .put("url", "url")
                    .put("mailoptions", "mail_options")
                    .put("commentoptions", "comment_options")
                    .put("backupoptions", "backup_options")
                    .put("baidusearchoptions", "baidu_search_options")
                    .put("algoliasearchoptions", "algolia_search_options")
                    .put("adminextra", "admin_extra")
                    .put("friendlinkoptions", "friend_link_options")
                    .put("s3options", "s3_options")
                    .put("imagebedoptions", "image_bed_options")
                    .put("imagestorageoptions", "image_storage_options")
                    .put("textoptions", "text_options")
                    .put("bingsearchoptions", "bing_search_options")
                    .put("meilisearchoptions", "meili_search_options")
                    .put("featurelist", "feature_list")
                    .put("barkoptions", "bark_options")
                    .put("authsecurity", "auth_security")
                    .put("ai", "ai")
                    .put("oauth", "oauth")
                    .put("thirdpartyserviceintegration", "third_party_service_integration")
                    .build();

    /**
     * Legacy template file names mapped to the option rows that store them.
     */
    public static final ImmutableMap<String, String> LEGACY_TEMPLATE_OPTIONS = ImmutableMap.of(
            "owner.template.ejs", "email_template_owner",
            "guest.template.ejs", "email_template_guest",
            "newsletter.template.ejs", "email_template_newsletter");

    @Generated
    private AliasTables() {}
}
