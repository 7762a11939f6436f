package com.example.ps3update.core;

import com.example.ps3update.config.Ps3Properties;
import com.example.ps3update.exception.InvalidTitleIdException;
import com.example.ps3update.exception.NoUpdatesFoundException;
import com.example.ps3update.exception.XmlParseException;
import com.example.ps3update.model.FetchResult;
import com.example.ps3update.model.PackageInfo;
import com.example.ps3update.testsupport.LocalHttpTestServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.ServerSocket;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class UpdateFetcherTest {

    private static final String PATH = "/tpl/np/BLES00779/BLES00779-ver.xml";

    private LocalHttpTestServer server;
    private UpdateFetcher fetcher;

    @BeforeEach
    void setUp() throws IOException {
        server = new LocalHttpTestServer();
        // 末尾的 / 会被去掉
        Ps3Properties properties = properties(server.getBaseUrl() + "/");
        fetcher = new UpdateFetcher(new HttpClientFactory(properties), properties);
    }

    @AfterEach
    void tearDown() {
        server.close();
    }

    private static Ps3Properties properties(String baseUrl) {
        Ps3Properties properties = new Ps3Properties();
        properties.getUpdate().setBaseUrl(baseUrl);
        properties.getHttp().setConnectTimeout(Duration.ofSeconds(2));
        properties.getHttp().setSocketTimeout(Duration.ofSeconds(5));
        return properties;
    }

    @Test
    void buildsMetadataUrlFromCleanedId() {
        assertThat(fetcher.metadataUrl("BLES00779")).isEqualTo(server.url(PATH));
    }

    @Test
    void returnsPackagesNewestFirst() {
        server.serveText(PATH, 200, "<titlepatch titleid=\"BLES00779\"><tag name=\"t\">"
                + "<package version=\"01.02\" size=\"1024\" url=\"http://h/v0102.pkg\" sha1sum=\"a\"/>"
                + "<package version=\"01.10\" size=\"2048\" url=\"http://h/v0110.pkg\" sha1sum=\"b\">"
                + "<paramsfo><TITLE>Demon's Souls</TITLE></paramsfo></package>"
                + "<package version=\"01.09\" size=\"4096\" url=\"http://h/v0109.pkg\" sha1sum=\"c\"/>"
                + "</tag></titlepatch>");

        FetchResult result = fetcher.fetchUpdates(" bles-00779 ");

        assertThat(result.getCleanedTitleId()).isEqualTo("BLES00779");
        assertThat(result.getGameTitle()).isEqualTo("Demon's Souls");
        assertThat(result.getError()).isNull();
        assertThat(result.getResults()).extracting(PackageInfo::getVersion).containsExactly("01.10", "01.09", "01.02");
        assertThat(result.getResults()).extracting(PackageInfo::getFilename)
                .containsExactly("v0110.pkg", "v0109.pkg", "v0102.pkg");
    }

    @Test
    void documentWithoutPackagesIsAnEmptyResult() {
        server.serveText(PATH, 200, "<titlepatch titleid=\"BLES00779\"><tag name=\"t\"/></titlepatch>");

        FetchResult result = fetcher.fetchUpdates("BLES00779");

        assertThat(result.getResults()).isEmpty();
        assertThat(result.getError()).isNull();
        assertThat(result.getGameTitle()).isEqualTo(UpdateXmlParser.UNKNOWN_TITLE);
    }

    @Test
    void missingMetadataMeansNoUpdates() {
        assertThatThrownBy(() -> fetcher.fetchUpdates("BLES00779"))
                .isInstanceOf(NoUpdatesFoundException.class)
                .hasMessageContaining("BLES00779");
    }

    @Test
    void blankBodyMeansNoUpdates() {
        server.serveText(PATH, 200, "  \n ");
        assertThatThrownBy(() -> fetcher.fetchUpdates("BLES00779")).isInstanceOf(NoUpdatesFoundException.class);
    }

    @Test
    void malformedBodyIsParseError() {
        server.serveText(PATH, 200, "<titlepatch><tag>");
        assertThatThrownBy(() -> fetcher.fetchUpdates("BLES00779")).isInstanceOf(XmlParseException.class);
    }

    @Test
    void invalidIdIsRejectedWithoutNetworkAccess() {
        assertThatThrownBy(() -> fetcher.fetchUpdates("BLES0077"))
                .isInstanceOf(InvalidTitleIdException.class)
                .hasMessage("Invalid title ID: BLES0077");
        assertThat(server.getRequestCount()).isZero();
    }

    @Test
    void serverStatusReflectsReachability() throws IOException {
        assertThat(fetcher.checkServerStatus()).isTrue();

        int closedPort;
        try (ServerSocket socket = new ServerSocket(0)) {
            closedPort = socket.getLocalPort();
        }
        Ps3Properties offline = properties("http://127.0.0.1:" + closedPort);
        UpdateFetcher offlineFetcher = new UpdateFetcher(new HttpClientFactory(offline), offline);
        assertThat(offlineFetcher.checkServerStatus()).isFalse();
    }
}
