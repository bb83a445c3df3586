package ai.gamedata.translator.markup;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

class LineClassifierTest {

    private final LineClassifier classifier = new LineClassifier();

    @Test
    void topLevelKnownKindEntersObjectAndAnythingElseLeaves() {
        ContextTracker tracker = new ContextTracker();

        assertThat(classify("ship \"Argosy\"", tracker)).isEqualTo(new Classification.EnterObject(ObjectType.SHIP));
        assertThat(classify("color \"red\" 1 0 0", tracker)).isEqualTo(Classification.LEAVE_OBJECT);
    }

    @Test
    void backtickLineOutsideNarrativeContextIsSkipped() {
        ContextTracker tracker = objectTracker(ObjectType.MISSION);

        assertThat(classify("\t\t`Some text.`", tracker)).isEqualTo(Classification.SKIP);
    }

    @Test
    void backtickLineInsideConversationTranslatesOnlyTheBacktickSpan() {
        ContextTracker tracker = objectTracker(ObjectType.MISSION);
        tracker.open(2, BlockContext.CONVERSATION);
        String body = "\t\t\t`Go on.` goto end";

        assertThat(texts(classify(body, tracker), body)).containsExactly("Go on.");
    }

    @Test
    void standaloneQuotedNarrativeTranslatesButKeyValuePairDoesNot() {
        ContextTracker tracker = objectTracker(ObjectType.CONVERSATION);

        assertThat(texts(classify("\t\"The hatch opens.\"", tracker), "\t\"The hatch opens.\"")).containsExactly("The hatch opens.");
        assertThat(classify("\t\"mass\" 5", tracker)).isEqualTo(Classification.SKIP);
    }

    @Test
    void controlKeywordsStopClassification() {
        ContextTracker tracker = objectTracker(ObjectType.MISSION);
        tracker.open(2, BlockContext.CONVERSATION);

        assertThat(classify("\t\t\tbranch \"accepted\"", tracker)).isEqualTo(Classification.SKIP);
        assertThat(classify("\t\t\tlabel start", tracker)).isEqualTo(Classification.SKIP);
    }

    @Test
    void blockOpenersReportTheirContext() {
        ContextTracker tracker = objectTracker(ObjectType.PHRASE);

        assertThat(classify("\tword", tracker)).isEqualTo(new Classification.OpenContext(1, BlockContext.WORD));
        assertThat(classify("\t\tchoice", tracker)).isEqualTo(new Classification.OpenContext(2, BlockContext.CHOICE));
        assertThat(classify("\tcommodity \"Food\" 100 400", tracker)).isEqualTo(new Classification.OpenContext(1, BlockContext.COMMODITY));
    }

    @Test
    void namedConversationIsAReferenceNotABlock() {
        ContextTracker tracker = objectTracker(ObjectType.MISSION);

        assertThat(classify("\t\tconversation \"intro\"", tracker)).isEqualTo(Classification.SKIP);
        assertThat(classify("\t\tconversation `intro`", tracker)).isEqualTo(Classification.SKIP);
        assertThat(classify("\t\tconversation", tracker)).isEqualTo(new Classification.OpenContext(2, BlockContext.CONVERSATION));
    }

    @Test
    void wordItemsTranslateTheFirstLiteral() {
        ContextTracker tracker = objectTracker(ObjectType.PHRASE);
        tracker.open(1, BlockContext.WORD);
        String body = "\t\t\"Hello\" \"ignored\"";

        assertThat(texts(classify(body, tracker), body)).containsExactly("Hello");
        assertThat(classify("\t\tphrase", tracker)).isEqualTo(Classification.SKIP);
    }

    @Test
    void commodityItemsNeedNothingAfterTheLiteral() {
        ContextTracker tracker = objectTracker(ObjectType.TRADE);
        tracker.open(1, BlockContext.COMMODITY);

        assertThat(texts(classify("\t\t\"bread\"", tracker), "\t\t\"bread\"")).containsExactly("bread");
        assertThat(classify("\t\t\"cheese\" 3", tracker)).isEqualTo(Classification.SKIP);
    }

    @Test
    void categoryItemsOnlyAtDepthOne() {
        ContextTracker tracker = objectTracker(ObjectType.CATEGORY);

        assertThat(texts(classify("\t\"Weapons\"", tracker), "\t\"Weapons\"")).containsExactly("Weapons");
        assertThat(classify("\t\"mass\" 5", tracker)).isEqualTo(Classification.SKIP);
        assertThat(classify("\t\t\"Nested\"", tracker)).isEqualTo(Classification.SKIP);
    }

    @Test
    void logTranslatesEveryLiteral() {
        ContextTracker tracker = objectTracker(ObjectType.MISSION);
        String body = "\t\tlog \"People\" \"Crew\" `You rescued them.`";

        assertThat(texts(classify(body, tracker), body)).containsExactly("People", "Crew", "You rescued them.");
    }

    @Test
    void dialogPhraseReferenceIsSkipped() {
        ContextTracker tracker = objectTracker(ObjectType.MISSION);

        assertThat(classify("\t\tdialog phrase \"greet\"", tracker)).isEqualTo(Classification.SKIP);
        assertThat(classify("\t\tdialog phrase `greet`", tracker)).isEqualTo(Classification.SKIP);
        String body = "\t\tdialog \"Hello <name>.\"";
        assertThat(texts(classify(body, tracker), body)).containsExactly("Hello <name>.");
    }

    @Test
    void dialogPhraseNeedsTheIdentifierRightAfterTheKeyword() {
        ContextTracker tracker = objectTracker(ObjectType.MISSION);
        String wordy = "\t\tdialog phrase of the day \"It's late.\"";
        String apostrophe = "\t\tdialog phrase it's `Hello`";

        assertThat(texts(classify(wordy, tracker), wordy)).containsExactly("It's late.");
        assertThat(texts(classify(apostrophe, tracker), apostrophe)).containsExactly("Hello");
    }

    @Test
    void referenceFieldsAreNeverTranslated() {
        ContextTracker tracker = objectTracker(ObjectType.SHIP);

        assertThat(classify("\tsprite \"ship/argosy\"", tracker)).isEqualTo(Classification.SKIP);
        assertThat(classify("\tgovernment \"Republic\"", tracker)).isEqualTo(Classification.SKIP);
    }

    @Test
    void translatableFieldsDependOnObjectType() {
        String name = "\tname \"Hauler\"";
        String description = "\tdescription `A sturdy hull.`";

        assertThat(classify(name, objectTracker(ObjectType.SHIP))).isEqualTo(Classification.SKIP);
        assertThat(texts(classify(description, objectTracker(ObjectType.SHIP)), description)).containsExactly("A sturdy hull.");
        assertThat(texts(classify(name, objectTracker(ObjectType.MISSION)), name)).containsExactly("Hauler");
        assertThat(texts(classify("\tspaceport `Busy.`", objectTracker(ObjectType.PLANET)), "\tspaceport `Busy.`")).containsExactly("Busy.");
        assertThat(classify(description, objectTracker(ObjectType.SYSTEM))).isEqualTo(Classification.SKIP);
        assertThat(classify(description, new ContextTracker())).isEqualTo(Classification.SKIP);
    }

    @Test
    void unclosedLiteralYieldsNoSpan() {
        ContextTracker tracker = objectTracker(ObjectType.OUTFIT);

        assertThat(classify("\tdescription \"never closed", tracker)).isEqualTo(Classification.SKIP);
    }

    @Test
    void blankLiteralIsNotTranslatable() {
        ContextTracker tracker = objectTracker(ObjectType.OUTFIT);

        assertThat(classify("\tdescription \"  \"", tracker)).isEqualTo(Classification.SKIP);
    }

    @Test
    void spanOffsetsPointIntoTheLineBody() {
        ContextTracker tracker = objectTracker(ObjectType.OUTFIT);
        String body = "\t  description \"Text\"";

        Classification.Translate translate = (Classification.Translate) classify(body, tracker);

        QuotedSpan span = translate.spans().get(0);
        assertThat(span.delimiter()).isEqualTo(Delimiter.DOUBLE_QUOTE);
        assertThat(body.charAt(span.start() - 1)).isEqualTo('"');
        assertThat(body.charAt(span.end())).isEqualTo('"');
        assertThat(span.interior(body)).isEqualTo("Text");
    }

    @Test
    void sameStateGivesSameDecision() {
        ContextTracker tracker = objectTracker(ObjectType.MISSION);
        tracker.open(2, BlockContext.CONVERSATION);
        String body = "\t\t\t`Again.`";

        assertThat(classify(body, tracker)).isEqualTo(classify(body, tracker));
        assertThat(tracker.snapshot()).containsOnlyKeys(0, 2);
    }

    private Classification classify(String body, ContextTracker tracker) {
        return classifier.classify(MarkupLine.of(0, body, "\n"), tracker);
    }

    private static ContextTracker objectTracker(ObjectType type) {
        ContextTracker tracker = new ContextTracker();
        tracker.enterObject(type);
        return tracker;
    }

    private static List<String> texts(Classification classification, String body) {
        assertThat(classification).isInstanceOf(Classification.Translate.class);
        return ((Classification.Translate) classification).spans().stream()
                .map(span -> span.trimmed(body))
                .collect(Collectors.toList());
    }
}
