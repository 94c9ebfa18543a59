package com.example.llmexplorer.fingerprint;

import com.example.llmexplorer.config.ExplorerProperties;
import com.example.llmexplorer.support.TestScreens;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StateFingerprinterTest {

    private static final String APP = "com.example.shop";

    private ExplorerProperties properties;
    private StateFingerprinter fingerprinter;

    @BeforeEach
    void setUp() {
        properties = new ExplorerProperties();
        fingerprinter = new StateFingerprinter(properties);
    }

    @Test
    void fingerprintIgnoresVolatileAttributes() {
        UiSnapshot first = loginScreen();
        UiSnapshot second = loginScreen();
        UiElementNode submit = second.getRoot().getChildren().get(1);
        submit.setBounds(new Bounds(10, 900, 400, 1000));
        submit.setFocused(true);
        submit.getExtras().put("index", "7");
        second.setCapturedAt(Instant.now().plusSeconds(30));

        assertThat(fingerprinter.fingerprint(first).getFingerprint())
                .isEqualTo(fingerprinter.fingerprint(second).getFingerprint());
    }

    @Test
    void fingerprintChangesWithStructureAndScreenName() {
        ObservedState base = fingerprinter.fingerprint(loginScreen());

        UiSnapshot extraButton = loginScreen();
        extraButton.getRoot().addChild(TestScreens.button(APP, "btn_forgot", "Forgot password"));
        UiSnapshot renamed = loginScreen();
        renamed.setScreenName("SignupActivity");

        assertThat(fingerprinter.fingerprint(extraButton).getFingerprint()).isNotEqualTo(base.getFingerprint());
        assertThat(fingerprinter.fingerprint(renamed).getFingerprint()).isNotEqualTo(base.getFingerprint());
    }

    @Test
    void textOnlyMattersAtTextLevel() {
        UiSnapshot relabeled = loginScreen();
        relabeled.getRoot().getChildren().get(1).setText("Continue");

        assertThat(fingerprinter.fingerprint(relabeled).getFingerprint())
                .isEqualTo(fingerprinter.fingerprint(loginScreen()).getFingerprint());

        properties.getFingerprint().setLevel(FingerprintLevel.TEXT);
        assertThat(fingerprinter.fingerprint(relabeled).getFingerprint())
                .isNotEqualTo(fingerprinter.fingerprint(loginScreen()).getFingerprint());
    }

    @Test
    void screenLevelOnlyLooksAtTheActivity() {
        properties.getFingerprint().setLevel(FingerprintLevel.SCREEN);
        UiSnapshot extraButton = loginScreen();
        extraButton.getRoot().addChild(TestScreens.button(APP, "btn_forgot", "Forgot password"));

        assertThat(fingerprinter.fingerprint(extraButton).getFingerprint())
                .isEqualTo(fingerprinter.fingerprint(loginScreen()).getFingerprint());
    }

    @Test
    void systemUiNodesAreIgnored() {
        UiSnapshot withStatusBar = loginScreen();
        withStatusBar.getRoot().addChild(UiElementNode.builder()
                .className("android.widget.TextView")
                .packageName("com.android.systemui")
                .text("12:45")
                .clickable(true)
                .build());

        ObservedState observed = fingerprinter.fingerprint(withStatusBar);

        assertThat(observed.getFingerprint()).isEqualTo(fingerprinter.fingerprint(loginScreen()).getFingerprint());
        assertThat(observed.getElements()).extracting(ActionableElement::getLabel).doesNotContain("12:45");
    }

    @Test
    void elementsAreNumberedInDocumentOrder() {
        ObservedState observed = fingerprinter.fingerprint(loginScreen());

        assertThat(observed.getElements()).extracting(ActionableElement::getId).containsExactly("E0", "E1");
        ActionableElement username = observed.getElements().get(0);
        assertThat(username.getRole()).isEqualTo(ElementRole.TEXT_FIELD);
        assertThat(username.getInteractions()).contains(Interaction.TYPE_TEXT, Interaction.TAP);
        assertThat(username.getLabel()).isEqualTo("Username");
        assertThat(observed.getElements().get(1).getRole()).isEqualTo(ElementRole.BUTTON);
        assertThat(observed.findElement("e1")).contains(observed.getElements().get(1));
    }

    @Test
    void clickableParentHandsTapDownToClickableChild() {
        UiElementNode card = UiElementNode.builder()
                .className("android.widget.LinearLayout")
                .packageName(APP)
                .resourceId(APP + ":id/card")
                .clickable(true)
                .longClickable(true)
                .build();
        card.addChild(TestScreens.button(APP, "btn_open", "Open"));
        UiSnapshot snapshot = TestScreens.screen(APP, "CardActivity", card);

        ObservedState observed = fingerprinter.fingerprint(snapshot);

        assertThat(observed.getElements()).hasSize(1);
        assertThat(observed.getElements().get(0).getLabel()).isEqualTo("Open");
    }

    @Test
    void labelFallsBackToChildTextsThenResourceId() {
        UiElementNode row = UiElementNode.builder()
                .className("android.widget.LinearLayout")
                .packageName(APP)
                .clickable(true)
                .build();
        row.addChild(TestScreens.label(APP, "Wi-Fi"));
        row.addChild(TestScreens.label(APP, "Connected"));
        UiElementNode icon = UiElementNode.builder()
                .className("android.widget.ImageButton")
                .packageName(APP)
                .resourceId(APP + ":id/btn_share")
                .clickable(true)
                .build();

        ObservedState observed = fingerprinter.fingerprint(TestScreens.screen(APP, "SettingsActivity", row, icon));

        assertThat(observed.getElements()).extracting(ActionableElement::getLabel)
                .containsExactly("Wi-Fi Connected", "btn_share");
    }

    @Test
    void listChildrenAreListItems() {
        UiElementNode list = UiElementNode.builder()
                .className("androidx.recyclerview.widget.RecyclerView")
                .packageName(APP)
                .scrollable(true)
                .build();
        for (int i = 0; i < 3; i++) {
            list.addChild(UiElementNode.builder()
                    .className("android.widget.FrameLayout")
                    .packageName(APP)
                    .text("Item " + i)
                    .clickable(true)
                    .build());
        }

        ObservedState observed = fingerprinter.fingerprint(TestScreens.screen(APP, "ListActivity", list));

        assertThat(observed.getElements().get(0).getRole()).isEqualTo(ElementRole.SCROLL_CONTAINER);
        assertThat(observed.getElements().get(0).getInteractions()).containsExactly(Interaction.SWIPE);
        assertThat(observed.getElements().subList(1, 4))
                .allMatch(e -> e.getRole() == ElementRole.LIST_ITEM);
    }

    @Test
    void summaryDetectsLoginPages() {
        ObservedState login = fingerprinter.fingerprint(loginScreen());
        ObservedState plain = fingerprinter.fingerprint(TestScreens.screen(APP, "MainActivity",
                TestScreens.button(APP, "btn_about", "About")));

        assertThat(login.getSummary().isLoginPage()).isTrue();
        assertThat(login.getSummary().getEditableCount()).isEqualTo(1);
        assertThat(plain.getSummary().isLoginPage()).isFalse();
    }

    @Test
    void actionKeysAreStableAcrossCapturesAndEndWithBack() {
        ObservedState first = fingerprinter.fingerprint(loginScreen());
        ObservedState second = fingerprinter.fingerprint(loginScreen());

        assertThat(first.actionKeys()).containsExactlyElementsOf(second.actionKeys());
        assertThat(first.actionKeys()).last().isEqualTo(ActionableElement.BACK_ACTION_KEY);
        assertThat(first.actionKeys().stream().filter(k -> k.endsWith("::TAP")).collect(Collectors.toList()))
                .hasSize(2);
    }

    @Test
    void actionKeysFollowTheFingerprintLevel() {
        UiSnapshot relabeled = loginScreen();
        relabeled.getRoot().getChildren().get(1).setText("Continue");

        ObservedState original = fingerprinter.fingerprint(loginScreen());
        ObservedState changed = fingerprinter.fingerprint(relabeled);
        assertThat(changed.getFingerprint()).isEqualTo(original.getFingerprint());
        assertThat(changed.actionKeys()).containsExactlyElementsOf(original.actionKeys());

        properties.getFingerprint().setLevel(FingerprintLevel.TEXT);
        assertThat(fingerprinter.fingerprint(relabeled).actionKeys())
                .isNotEqualTo(fingerprinter.fingerprint(loginScreen()).actionKeys());
    }

    @Test
    void repeatedElementsGetDistinctActionKeys() {
        UiElementNode list = UiElementNode.builder()
                .className("android.widget.ListView")
                .packageName(APP)
                .build();
        for (int i = 0; i < 3; i++) {
            list.addChild(UiElementNode.builder()
                    .className("android.widget.TextView")
                    .packageName(APP)
                    .resourceId(APP + ":id/row")
                    .text("Order " + i)
                    .clickable(true)
                    .build());
        }

        ObservedState observed = fingerprinter.fingerprint(TestScreens.screen(APP, "OrdersActivity", list));

        assertThat(observed.getElements()).hasSize(3);
        assertThat(observed.getElements().stream().map(e -> e.actionKey(Interaction.TAP)).distinct().count())
                .isEqualTo(3);
        assertThat(observed.getElements().get(1).getStructuralKey())
                .isEqualTo(observed.getElements().get(0).getStructuralKey() + "#2");
    }

    @Test
    void disabledElementsAreNotActionable() {
        UiElementNode disabled = TestScreens.button(APP, "btn_pay", "Pay");
        disabled.setEnabled(false);

        ObservedState observed = fingerprinter.fingerprint(TestScreens.screen(APP, "CartActivity", disabled));

        assertThat(observed.getElements()).isEmpty();
    }

    @Test
    void emptyOrMissingCapturesAreRejected() {
        UiSnapshot noRoot = UiSnapshot.builder().screenName("MainActivity").build();
        UiSnapshot noScreen = loginScreen();
        noScreen.setScreenName(" ");
        UiSnapshot blank = UiSnapshot.builder().screenName("MainActivity").root(new UiElementNode()).build();

        assertThatThrownBy(() -> fingerprinter.fingerprint(null)).isInstanceOf(CaptureException.class);
        assertThatThrownBy(() -> fingerprinter.fingerprint(noRoot)).isInstanceOf(CaptureException.class);
        assertThatThrownBy(() -> fingerprinter.fingerprint(noScreen)).isInstanceOf(CaptureException.class);
        assertThatThrownBy(() -> fingerprinter.fingerprint(blank)).isInstanceOf(CaptureException.class);
    }

    @Test
    void sha256MatchesKnownVector() {
        assertThat(StateFingerprinter.sha256Hex("abc"))
                .isEqualTo("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad");
    }

    private static UiSnapshot loginScreen() {
        return TestScreens.screen(APP, "LoginActivity",
                TestScreens.editText(APP, "username", "Username"),
                TestScreens.button(APP, "btn_login", "Sign in"));
    }
}
