package com.delta.jobscraper.crawl.model;

/**
 * Selector and setting names understood in the sources file.
 */
public final class SourceKeys {
    public static final String JOB_LINK = "job_link";
    public static final String NEXT_PAGE = "next_page";
    public static final String NEXT_PAGE_DISABLED = "next_page_disabled";
    public static final String IFRAME = "iframe";
    public static final String JOB_TABLE = "job_table";
    public static final String JOB_BUTTON = "job_button";
    public static final String BACK_BUTTON = "back_button";
    public static final String VIEW_ALL_BUTTON = "view_all_button";
    public static final String COOKIE_MODAL_CLASS = "cookie_modal_class";
    public static final String COOKIE_ACCEPT = "cookie_accept";

    public static final String MAX_PAGES = "max_pages";
    public static final String MIN_NEW_JOBS_PER_PAGE = "min_new_jobs_per_page";
    public static final String EARLY_STOP_ENABLED = "early_stop_enabled";
    public static final String SLEEP_BETWEEN_JOBS = "sleep_between_jobs";
    public static final String MAX_CONSECUTIVE_ERRORS = "max_consecutive_errors";
    public static final String SETTLE_MS = "settle_ms";
    public static final String FRAME_SETTLE_MS = "frame_settle_ms";
    public static final String START_PAGE = "start_page";
    public static final String URL_PATTERN = "url_pattern";
    public static final String WAIT_BETWEEN_PAGES_MIN = "wait_between_pages_min";
    public static final String WAIT_BETWEEN_PAGES_MAX = "wait_between_pages_max";
    public static final String BASE_URL = "base_url";
    public static final String HANDLE_COOKIES = "handle_cookies";
    public static final String ITEM_URL_PATTERN = "item_url_pattern";
    public static final String CLICK_BACK_AFTER_JOB = "click_back_after_job";
    public static final String CLICK_VIEW_ALL_AFTER_BACK = "click_view_all_after_back";

    private SourceKeys() {
    }
}
