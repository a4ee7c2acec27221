package vn.com.fecredit.filestore.client;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ClientAppTest {

    @Test
    void testParseArgs() {
        Map<String, String> params = ClientApp.parseArgs(new String[]{
                "upload", "--url=http://localhost:8080", "--file=/tmp/a=b.txt", "--verbose", "--tenant=alice"});

        assertEquals("http://localhost:8080", params.get("url"));
        assertEquals("/tmp/a=b.txt", params.get("file"));
        assertEquals("alice", params.get("tenant"));
        assertFalse(params.containsKey("verbose"));
        assertFalse(params.containsKey("upload"));
    }

    @Test
    void testRun_MissingUrl() {
        assertEquals(1, ClientApp.run(new String[]{"upload", "--file=a.txt"}));
    }

    @Test
    void testRun_UnknownCommand() {
        assertEquals(1, ClientApp.run(new String[]{"list", "--url=http://localhost:8080"}));
    }

    @Test
    void testRun_UploadWithoutFile() {
        assertEquals(1, ClientApp.run(new String[]{"upload", "--url=http://localhost:8080"}));
    }

    @Test
    void testRun_DownloadWithoutTarget() {
        assertEquals(1, ClientApp.run(new String[]{"download", "--url=http://localhost:8080", "--artifact=a.txt"}));
    }
}
