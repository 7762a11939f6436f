package com.example.ps3update.core;

import com.example.ps3update.config.Ps3Properties;
import com.example.ps3update.model.ProbeResult;
import com.example.ps3update.testsupport.LocalHttpTestServer;
import org.apache.http.HttpVersion;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.message.BasicHttpResponse;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class ResourceProberTest {

    private LocalHttpTestServer server;
    private CloseableHttpClient client;
    private final ResourceProber prober = new ResourceProber();

    @BeforeEach
    void setUp() throws IOException {
        server = new LocalHttpTestServer();
        Ps3Properties properties = new Ps3Properties();
        properties.getHttp().setConnectTimeout(Duration.ofSeconds(2));
        properties.getHttp().setSocketTimeout(Duration.ofSeconds(5));
        client = new HttpClientFactory(properties).createHttpClient(5);
    }

    @AfterEach
    void tearDown() throws IOException {
        client.close();
        server.close();
    }

    @Test
    void advertisedRangesNeedOnlyHead() {
        server.serveFile("/f.pkg", new byte[4096]);

        ProbeResult result = prober.probe(client, server.url("/f.pkg"));

        assertThat(result.getTotalSize()).isEqualTo(4096);
        assertThat(result.isSupportRange()).isTrue();
    }

    @Test
    void trialRangeAfterHeadOnSameClient() {
        LocalHttpTestServer.FileRoute route = server.serveFile("/f.pkg", new byte[4096]).withoutAcceptRangesHeader();

        // 同一个连接池里 HEAD 之后再发 Range 试探
        ProbeResult first = prober.probe(client, server.url("/f.pkg"));
        ProbeResult second = prober.probe(client, server.url("/f.pkg"));

        assertThat(first.isSupportRange()).isTrue();
        assertThat(first.getTotalSize()).isEqualTo(4096);
        assertThat(second.isSupportRange()).isTrue();
        assertThat(route.getRangeHeaders()).containsOnly("bytes=0-0");
    }

    @Test
    void rangeTrialWorksWhenHeadIsRejected() {
        server.serveFile("/f.pkg", new byte[2048]).withoutHead();

        ProbeResult result = prober.probe(client, server.url("/f.pkg"));

        assertThat(result.getTotalSize()).isEqualTo(2048);
        assertThat(result.isSupportRange()).isTrue();
    }

    @Test
    void serverWithoutRangesKeepsLengthOnly() {
        server.serveFile("/f.pkg", new byte[2048]).withoutRangeSupport();

        ProbeResult result = prober.probe(client, server.url("/f.pkg"));

        assertThat(result.getTotalSize()).isEqualTo(2048);
        assertThat(result.isSupportRange()).isFalse();
    }

    @Test
    void chunkedResourceIsUnknown() {
        server.serveFile("/f.pkg", new byte[2048]).chunked();

        ProbeResult result = prober.probe(client, server.url("/f.pkg"));

        assertThat(result.isSizeKnown()).isFalse();
        assertThat(result.isSupportRange()).isFalse();
    }

    @Test
    void totalFromContentRange() {
        BasicHttpResponse response = new BasicHttpResponse(HttpVersion.HTTP_1_1, 206, "Partial Content");
        response.setHeader("Content-Range", "bytes 0-0/12345");
        assertThat(ResourceProber.totalFromContentRange(response)).isEqualTo(12345);

        response.setHeader("Content-Range", "bytes 0-0/*");
        assertThat(ResourceProber.totalFromContentRange(response)).isEqualTo(-1);
    }
}
