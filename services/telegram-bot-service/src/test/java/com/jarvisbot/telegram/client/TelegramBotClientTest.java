package com.jarvisbot.telegram.client;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.jarvisbot.telegram.model.InlineKeyboard;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

class TelegramBotClientTest {

  private MockRestServiceServer server;
  private TelegramBotClient bot;

  @BeforeEach
  void setUp() {
    RestClient.Builder builder = RestClient.builder();
    server = MockRestServiceServer.bindTo(builder).build();
    bot = new TelegramBotClient(builder.build(), "T0K");
  }

  @Test
  void sendMessage_withKeyboard_returnsMessageId() {
    server
        .expect(requestTo("https://api.telegram.org/botT0K/sendMessage"))
        .andExpect(jsonPath("$.chat_id").value("100"))
        .andExpect(jsonPath("$.reply_markup.inline_keyboard[0][0].callback_data").value("s1"))
        .andRespond(
            withSuccess("{\"ok\":true,\"result\":{\"message_id\":555}}",
                MediaType.APPLICATION_JSON));

    String id =
        bot.sendMessage(
            "100",
            "hi",
            null,
            new InlineKeyboard(List.of(List.of(new InlineKeyboard.Button("⏭ Skip", "s1")))));

    assertThat(id).isEqualTo("555");
    server.verify();
  }

  @Test
  void downloadFile_resolvesPathThenFetchesBytes() {
    server
        .expect(requestTo("https://api.telegram.org/botT0K/getFile?file_id=F1"))
        .andRespond(
            withSuccess(
                "{\"ok\":true,\"result\":{\"file_path\":\"voice/file_1.oga\"}}",
                MediaType.APPLICATION_JSON));
    server
        .expect(requestTo("https://api.telegram.org/file/botT0K/voice/file_1.oga"))
        .andRespond(withSuccess(new byte[] {4, 5, 6}, MediaType.APPLICATION_OCTET_STREAM));

    assertThat(bot.downloadFile("F1")).containsExactly(4, 5, 6);
  }

  @Test
  void failures_areReportedAsNull() {
    server.expect(requestTo("https://api.telegram.org/botT0K/getFile?file_id=F1"))
        .andRespond(withServerError());

    assertThat(bot.downloadFile("F1")).isNull();
  }

  @Test
  void setWebhook_sendsSecret() {
    server
        .expect(requestTo("https://api.telegram.org/botT0K/setWebhook"))
        .andExpect(content()
            .json("{\"url\":\"https://bot.example/telegram/webhook\",\"secret_token\":\"s3\"}"))
        .andRespond(withSuccess("{\"ok\":true}", MediaType.APPLICATION_JSON));

    assertThat(bot.setWebhook("https://bot.example/telegram/webhook", "s3")).isTrue();
  }

  @Test
  void missingToken_skipsCalls() {
    TelegramBotClient unconfigured = new TelegramBotClient(RestClient.create(), "");

    assertThat(unconfigured.sendMessage("1", "x")).isNull();
    assertThat(unconfigured.isConfigured()).isFalse();
  }
}
