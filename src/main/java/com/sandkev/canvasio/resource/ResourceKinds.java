package com.sandkev.canvasio.resource;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The Canvas kinds this client knows about. Declared leaf-first so parents can list their
 * children.
 */
public final class ResourceKinds {

    private ResourceKinds() {}

    public static final ResourceKind QUIZ_QUESTION = new ResourceKind(
            "quiz question", "questions", "id", "question_name", "question_text", null, "question", Map.of());

    public static final ResourceKind MODULE_ITEM = new ResourceKind(
            "module item", "items", "id", "title", null, "html_url", "module_item", Map.of());

    public static final ResourceKind ASSIGNMENT = new ResourceKind(
            "assignment", "assignments", "id", "name", "description", "html_url", "assignment", Map.of());

    public static final ResourceKind DISCUSSION = new ResourceKind(
            "discussion", "discussion_topics", "id", "title", "message", "html_url", null, Map.of());

    // pages are addressed by their url slug, not a numeric id
    public static final ResourceKind PAGE = new ResourceKind(
            "page", "pages", "url", "title", "body", "html_url", "wiki_page", Map.of());

    public static final ResourceKind FILE = new ResourceKind(
            "file", "files", "id", "display_name", null, "url", null, Map.of());

    public static final ResourceKind FOLDER = new ResourceKind(
            "folder", "folders", "id", "name", null, null, null, Map.of());

    public static final ResourceKind QUIZ = new ResourceKind(
            "quiz", "quizzes", "id", "title", "description", "html_url", "quiz",
            Map.of("questions", QUIZ_QUESTION));

    public static final ResourceKind MODULE = new ResourceKind(
            "module", "modules", "id", "name", null, null, "module",
            Map.of("items", MODULE_ITEM));

    public static final ResourceKind COURSE = new ResourceKind(
            "course", "courses", "id", "name", "syllabus_body", "html_url", "course",
            courseChildren());

    private static Map<String, ResourceKind> courseChildren() {
        var children = new LinkedHashMap<String, ResourceKind>();
        children.put("assignments", ASSIGNMENT);
        children.put("discussions", DISCUSSION);
        children.put("pages", PAGE);
        children.put("quizzes", QUIZ);
        children.put("modules", MODULE);
        children.put("files", FILE);
        children.put("folders", FOLDER);
        return children;
    }
}
