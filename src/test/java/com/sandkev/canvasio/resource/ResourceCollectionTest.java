package com.sandkev.canvasio.resource;

import com.sandkev.canvasio.CanvasClient;
import com.sandkev.canvasio.scheduler.CanvasApiException;
import com.sandkev.canvasio.scheduler.PendingCall;
import com.sandkev.canvasio.testsupport.FakeCanvasTransport;
import com.sandkev.canvasio.testsupport.TestClients;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.lang.ref.WeakReference;
import java.util.Map;

import static com.sandkev.canvasio.testsupport.FakeCanvasTransport.json;
import static com.sandkev.canvasio.testsupport.FakeCanvasTransport.page;
import static com.sandkev.canvasio.testsupport.TestWait.failureOf;
import static com.sandkev.canvasio.testsupport.TestWait.result;
import static com.sandkev.canvasio.testsupport.TestWait.until;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.http.HttpMethod.DELETE;
import static org.springframework.http.HttpMethod.GET;
import static org.springframework.http.HttpMethod.POST;
import static org.springframework.http.HttpMethod.PUT;

class ResourceCollectionTest {

    private static final String COURSE = "/api/v1/courses/42";
    private static final String ASSIGNMENTS = COURSE + "/assignments";

    private final FakeCanvasTransport canvas = new FakeCanvasTransport();
    private CanvasClient client;
    private ResourceNode course;

    @BeforeEach
    void setUp() {
        client = TestClients.client(canvas);
        course = client.course("42");
    }

    @AfterEach
    void tearDown() {
        client.close();
    }

    @Test
    void getLoadsEveryPageInServerOrder() throws Exception {
        canvas.on(GET, ASSIGNMENTS, page("[{\"id\":3,\"name\":\"C\"},{\"id\":1,\"name\":\"A\"}]",
                "https://school.instructure.com" + ASSIGNMENTS + "?page=2&per_page=100"));
        canvas.on(GET, "https://school.instructure.com" + ASSIGNMENTS, page("[{\"id\":2,\"name\":\"B\"}]", null));
        ResourceCollection assignments = course.collection("assignments");

        result(assignments.get());

        assertThat(assignments.items()).extracting(ResourceNode::getTitle).containsExactly("C", "A", "B");
        assertThat(assignments).allMatch(n -> !n.isDirty());
        assertThat(canvas.calls().get(0).query()).containsEntry("per_page", 100);
    }

    @Test
    void getIsAFullResync() throws Exception {
        canvas.on(GET, ASSIGNMENTS,
                page("[{\"id\":1,\"name\":\"A\"},{\"id\":2,\"name\":\"B\"}]", null),
                page("[{\"id\":2,\"name\":\"B\"},{\"id\":2,\"name\":\"B dup\"}]", null));
        ResourceCollection assignments = course.collection("assignments");
        result(assignments.get());
        ResourceNode before = assignments.find("2").orElseThrow();
        before.setTitle("edited");

        result(assignments.get());

        assertThat(assignments.items()).extracting(ResourceNode::getId).containsExactly("2");
        ResourceNode after = assignments.find("2").orElseThrow();
        assertThat(after).isNotSameAs(before);
        assertThat(after.getTitle()).isEqualTo("B");
    }

    @Test
    void getOneReplacesExistingNodeInPlace() throws Exception {
        canvas.on(GET, ASSIGNMENTS, page("[{\"id\":1,\"name\":\"A\"},{\"id\":2,\"name\":\"B\"},{\"id\":3,\"name\":\"C\"}]", null));
        canvas.on(GET, ASSIGNMENTS + "/2", json(200, "{\"id\":2,\"name\":\"B (fresh)\"}"));
        canvas.on(GET, ASSIGNMENTS + "/4", json(200, "{\"id\":4,\"name\":\"D\"}"));
        ResourceCollection assignments = course.collection("assignments");
        result(assignments.get());

        result(assignments.getOne("2"));
        result(assignments.getOne("4"));

        assertThat(assignments.items()).extracting(ResourceNode::getTitle).containsExactly("A", "B (fresh)", "C", "D");
    }

    @Test
    void getOneCompleteFetchesItemAndItsSubItems() throws Exception {
        canvas.on(GET, COURSE + "/quizzes/42", json(200, "{\"id\":42,\"title\":\"Midterm\"}"));
        canvas.on(GET, COURSE + "/quizzes/42/questions",
                page("[{\"id\":1,\"question_name\":\"Q1\"},{\"id\":2,\"question_name\":\"Q2\"}]", null));

        ResourceNode quiz = result(course.collection("quizzes").getOneComplete("42"));

        assertThat(quiz.getTitle()).isEqualTo("Midterm");
        assertThat(quiz.collection("questions").size()).isEqualTo(2);
        assertThat(canvas.count(GET, COURSE + "/quizzes/42")).isEqualTo(1);
        assertThat(canvas.count(GET, COURSE + "/quizzes/42/questions")).isEqualTo(1);
        assertThat(canvas.calls()).hasSize(2);
    }

    @Test
    void createAppendsCleanNodeAndUpdateIsThenNoOp() throws Exception {
        canvas.on(POST, ASSIGNMENTS, json(201, "{\"id\":99,\"name\":\"Essay\",\"points_possible\":10}"));
        ResourceCollection assignments = course.collection("assignments");

        ResourceNode essay = result(assignments.create(Map.of("name", "Essay", "points_possible", 10)));
        result(essay.update());

        assertThat(canvas.calls(POST).get(0).body())
                .isEqualTo(Map.of("assignment", Map.of("name", "Essay", "points_possible", 10)));
        assertThat(essay.getId()).isEqualTo("99");
        assertThat(essay.isDirty()).isFalse();
        assertThat(assignments.items()).containsExactly(essay);
        assertThat(canvas.calls()).hasSize(1);
    }

    @Test
    void createSendsBareFieldsForUnwrappedKinds() throws Exception {
        canvas.on(POST, COURSE + "/discussion_topics", json(200, "{\"id\":5,\"title\":\"Intro\",\"message\":\"hi\"}"));

        result(course.collection("discussions").create(Map.of("title", "Intro", "message", "hi")));

        assertThat(canvas.calls(POST).get(0).body()).isEqualTo(Map.of("title", "Intro", "message", "hi"));
    }

    @Test
    void firstSaveOfLocallyAddedNodeIsACreate() throws Exception {
        canvas.on(POST, COURSE + "/modules", json(200, "{\"id\":12,\"name\":\"Week 2\",\"position\":2}"));
        ResourceCollection modules = course.collection("modules");
        ResourceNode week2 = modules.add(Map.of("name", "Week 2"));
        assertThat(week2.getId()).isNull();
        assertThat(week2.isDirty()).isTrue();

        result(modules.update());
        result(modules.update());

        assertThat(canvas.calls(POST)).hasSize(1);
        assertThat(canvas.calls(POST).get(0).body()).isEqualTo(Map.of("module", Map.of("name", "Week 2")));
        assertThat(week2.getId()).isEqualTo("12");
        assertThat(week2.get("position")).isEqualTo(2);
        assertThat(week2.isDirty()).isFalse();
    }

    @Test
    void failedCreateSkipsChildrenOfTheUnsavedNode() throws Exception {
        canvas.on(POST, COURSE + "/quizzes", json(400, "{\"errors\":{\"title\":[\"blank\"]}}"));
        ResourceNode quiz = course.collection("quizzes").add(Map.of("title", ""));
        quiz.collection("questions").add(Map.of("question_name", "orphan"));

        Throwable failure = failureOf(quiz.update());

        assertThat(failure).isInstanceOf(CascadeUpdateException.class);
        assertThat(canvas.calls()).extracting(PendingCall::url).containsExactly(COURSE + "/quizzes");
        assertThat(quiz.isDirty()).isTrue();
    }

    @Test
    void childrenOfADraftAreCreatedUnderItOnceItExists() throws Exception {
        canvas.on(POST, COURSE + "/quizzes", json(200, "{\"id\":8,\"title\":\"Quiz\"}"));
        canvas.on(POST, COURSE + "/quizzes/8/questions", json(200, "{\"id\":81,\"question_name\":\"Q1\"}"));
        ResourceNode quiz = course.collection("quizzes").add(Map.of("title", "Quiz"));
        ResourceNode q1 = quiz.collection("questions").add(Map.of("question_name", "Q1"));
        assertThatThrownBy(() -> quiz.collection("questions").get()).isInstanceOf(IllegalStateException.class);

        result(quiz.update());

        assertThat(canvas.calls()).extracting(PendingCall::url)
                .containsExactly(COURSE + "/quizzes", COURSE + "/quizzes/8/questions");
        assertThat(q1.getId()).isEqualTo("81");
        assertThat(q1.isDirty()).isFalse();
        assertThat(quiz.isDirty()).isFalse();
    }

    @Test
    void childCollectionOutlivesItsCourse() throws Exception {
        canvas.on(GET, "/api/v1/courses", page("[]", null));
        canvas.on(GET, "/api/v1/courses/7/assignments", page("[{\"id\":1,\"name\":\"A\"}]", null));
        ResourceCollection assignments = client.course("7").collection("assignments");
        var courseRef = new WeakReference<>(assignments.owner().orElseThrow());
        // a full resync of the courses forgets course 7
        result(client.courses().get());

        until(() -> {
            System.gc();
            return courseRef.get() == null;
        });
        result(assignments.get());

        assertThat(assignments.owner()).isEmpty();
        assertThat(assignments.items()).extracting(ResourceNode::getTitle).containsExactly("A");
    }

    @Test
    void updateWritesOnlyDirtyNodes() throws Exception {
        canvas.on(GET, ASSIGNMENTS, page("[{\"id\":1,\"name\":\"A\"},{\"id\":2,\"name\":\"B\"},{\"id\":3,\"name\":\"C\"},{\"id\":4,\"name\":\"D\"}]", null));
        canvas.on(PUT, ASSIGNMENTS + "/3", json(200, "{\"id\":3,\"name\":\"C!\"}"));
        ResourceCollection assignments = course.collection("assignments");
        result(assignments.get());

        assignments.find("3").orElseThrow().setTitle("C!");
        result(assignments.update());

        assertThat(canvas.calls(PUT)).extracting(PendingCall::url).containsExactly(ASSIGNMENTS + "/3");
    }

    @Test
    void deleteRemovesOnlyAfterServerConfirms() throws Exception {
        canvas.on(GET, ASSIGNMENTS, page("[{\"id\":1,\"name\":\"A\"},{\"id\":2,\"name\":\"B\"}]", null));
        canvas.on(DELETE, ASSIGNMENTS + "/1", json(200, "{\"id\":1}"));
        canvas.on(DELETE, ASSIGNMENTS + "/2", json(401, "{\"status\":\"unauthorized\"}"));
        ResourceCollection assignments = course.collection("assignments");
        result(assignments.get());

        result(assignments.delete("1"));
        Throwable failure = failureOf(assignments.delete("2"));

        assertThat(failure).isInstanceOf(CanvasApiException.class);
        assertThat(assignments.items()).extracting(ResourceNode::getId).containsExactly("2");
    }

    @Test
    void blankIdsAreRejectedBeforeAnyRequest() {
        ResourceCollection assignments = course.collection("assignments");

        assertThatThrownBy(() -> assignments.delete(" ")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> assignments.getOne(null)).isInstanceOf(IllegalArgumentException.class);
        assertThat(canvas.calls()).isEmpty();
    }

    @Test
    void unknownChildCollectionIsAnError() {
        assertThatThrownBy(() -> course.collection("grades")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rootCoursesCollectionListsCourses() throws Exception {
        canvas.on(GET, "/api/v1/courses", page("[{\"id\":1,\"name\":\"Bio\"},{\"id\":2,\"name\":\"Chem\"}]", null));

        ResourceCollection courses = result(client.courses().get());

        assertThat(courses.items()).extracting(ResourceNode::getTitle).containsExactly("Bio", "Chem");
        assertThat(courses.find("2").orElseThrow().collection("pages").owner()).isPresent();
    }
}
