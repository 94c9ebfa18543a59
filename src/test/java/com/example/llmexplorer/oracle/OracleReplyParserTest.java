package com.example.llmexplorer.oracle;

import com.example.llmexplorer.fingerprint.Interaction;
import com.example.llmexplorer.fingerprint.SwipeDirection;
import com.example.llmexplorer.support.TestExplorer;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class OracleReplyParserTest {

    private final OracleReplyParser parser = new OracleReplyParser(TestExplorer.objectMapper());

    @Test
    void parsesPlainJsonAction() {
        OracleReply reply = parser.parse("{\"action\":\"tap\",\"element\":\"E3\",\"reason\":\"open the cart\"}");

        assertThat(reply.getKind()).isEqualTo(OracleReply.Kind.ACTION);
        assertThat(reply.getInteraction()).isEqualTo(Interaction.TAP);
        assertThat(reply.getElementId()).isEqualTo("E3");
        assertThat(reply.getReason()).isEqualTo("open the cart");
    }

    @Test
    void toleratesProseAroundTheJson() {
        OracleReply reply = parser.parse("Sure! Here is my choice:\n```json\n"
                + "{\"action\": \"type_text\", \"element\": \"E1\", \"text\": \"alice\"}\n```\nGood luck.");

        assertThat(reply.getInteraction()).isEqualTo(Interaction.TYPE_TEXT);
        assertThat(reply.getText()).isEqualTo("alice");
    }

    @Test
    void swipeNeedsAValidDirection() {
        assertThat(parser.parse("{\"action\":\"swipe\",\"element\":\"E2\",\"direction\":\"down\"}").getDirection())
                .isEqualTo(SwipeDirection.DOWN);
        assertThat(parser.parse("{\"action\":\"swipe\",\"element\":\"E2\"}").getKind())
                .isEqualTo(OracleReply.Kind.INVALID);
        assertThat(parser.parse("{\"action\":\"swipe\",\"element\":\"E2\",\"direction\":\"sideways\"}").getKind())
                .isEqualTo(OracleReply.Kind.INVALID);
    }

    @Test
    void backNeedsNoElement() {
        OracleReply reply = parser.parse("{\"action\":\"back\"}");

        assertThat(reply.getKind()).isEqualTo(OracleReply.Kind.ACTION);
        assertThat(reply.getInteraction()).isEqualTo(Interaction.BACK);
        assertThat(reply.getElementId()).isNull();
    }

    @Test
    void stopCarriesVerdict() {
        assertThat(parser.parse("{\"action\":\"stop\",\"verdict\":\"goal_reached\"}").getVerdict())
                .isEqualTo(StopVerdict.GOAL_REACHED);
        assertThat(parser.parse("{\"action\":\"stop\"}").getVerdict()).isEqualTo(StopVerdict.ORACLE_DONE);
        assertThat(parser.parse("{\"action\":\"stop\",\"verdict\":\"bored\"}").getKind())
                .isEqualTo(OracleReply.Kind.INVALID);
    }

    @Test
    void structurallyBrokenRepliesAreInvalidWithAProblem() {
        assertThat(parser.parse("").getProblem()).contains("empty");
        assertThat(parser.parse("I would tap the login button").getProblem()).contains("no JSON");
        assertThat(parser.parse("{\"element\":\"E1\"}").getProblem()).contains("action");
        assertThat(parser.parse("{\"action\":\"tap\"}").getProblem()).contains("element");
        assertThat(parser.parse("{\"action\":\"fly\",\"element\":\"E1\"}").getProblem()).contains("unknown action");
        assertThat(parser.parse("{\"action\": tap, }").getKind()).isEqualTo(OracleReply.Kind.INVALID);
    }

    @Test
    void acceptsFunctionCallShorthand() {
        OracleReply tap = parser.parse("tap(E4)");
        OracleReply type = parser.parse("I'll do type_text(E1, \"hello world\")");
        OracleReply swipe = parser.parse("swipe(E2, 'left')");
        OracleReply back = parser.parse("back()");
        OracleReply stop = parser.parse("stop()");

        assertThat(tap.getInteraction()).isEqualTo(Interaction.TAP);
        assertThat(tap.getElementId()).isEqualTo("E4");
        assertThat(type.getText()).isEqualTo("hello world");
        assertThat(swipe.getDirection()).isEqualTo(SwipeDirection.LEFT);
        assertThat(back.getInteraction()).isEqualTo(Interaction.BACK);
        assertThat(stop.getKind()).isEqualTo(OracleReply.Kind.STOP);
    }

    @Test
    void readsOptionalScreenDescription() {
        OracleReply action = parser.parse("{\"action\":\"tap\",\"element\":\"E0\","
                + "\"screen_description\":\"Login form with username and password\"}");
        OracleReply stop = parser.parse("{\"action\":\"stop\",\"screen_description\":\"Empty cart\"}");
        OracleReply blank = parser.parse("{\"action\":\"back\",\"screen_description\":\"  \"}");

        assertThat(action.getScreenDescription()).isEqualTo("Login form with username and password");
        assertThat(stop.getScreenDescription()).isEqualTo("Empty cart");
        assertThat(blank.getScreenDescription()).isNull();
    }
}
