package io.github.drompincen.carebridge.runtime.source;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.carebridge.protocol.sync.ChangeBatch;
import io.github.drompincen.carebridge.protocol.sync.ChangeRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class CouchDbChangeSourceTest {

    @Mock private HttpClient httpClient;
    @Mock private HttpResponse<String> response;

    private CouchDbChangeSource source;

    @BeforeEach
    void setUp() throws Exception {
        source = new CouchDbChangeSource(httpClient, new ObjectMapper(), "http://couch:5984/", "healthbridge",
                "", "", 5000);
        doReturn(response).when(httpClient).send(any(HttpRequest.class), any());
        when(response.statusCode()).thenReturn(200);
    }

    @Test
    void parsesChangesWithInlinedDocuments() throws Exception {
        when(response.body()).thenReturn("""
                {"results":[
                  {"seq":"11-abc","id":"patient:1","changes":[{"rev":"2-x"}],
                   "doc":{"_id":"patient:1","_rev":"2-x","type":"patient"}},
                  {"seq":"12-def","id":"session:9","changes":[{"rev":"4-y"}],"deleted":true},
                  {"seq":"13-ghi","id":"form:3","changes":[{"rev":"1-z"}]}
                 ],
                 "last_seq":"13-ghi","pending":0}
                """);

        ChangeBatch batch = source.fetchChanges("10-xyz", 50);

        assertThat(batch.changes()).extracting(ChangeRecord::id).containsExactly("patient:1", "session:9");
        ChangeRecord patient = batch.changes().get(0);
        assertThat(patient.revision()).isEqualTo("2-x");
        assertThat(patient.type()).isEqualTo("patient");
        ChangeRecord deletion = batch.changes().get(1);
        assertThat(deletion.deleted()).isTrue();
        assertThat(deletion.revision()).isEqualTo("4-y");
        assertThat(batch.newCursor()).isEqualTo("13-ghi");
        assertThat(batch.hasMore()).isFalse();

        ArgumentCaptor<HttpRequest> request = ArgumentCaptor.forClass(HttpRequest.class);
        verify(httpClient).send(request.capture(), any());
        assertThat(request.getValue().uri().toString()).isEqualTo(
                "http://couch:5984/healthbridge/_changes?include_docs=true&feed=normal&since=10-xyz&limit=50");
        assertThat(request.getValue().headers().firstValue("Authorization")).isEmpty();
    }

    @Test
    void pendingChangesMeanMoreToFetch() {
        when(response.body()).thenReturn("{\"results\":[],\"last_seq\":42,\"pending\":7}");

        ChangeBatch batch = source.fetchChanges(ChangeSource.BEGINNING, 100);

        assertThat(batch.changes()).isEmpty();
        assertThat(batch.newCursor()).isEqualTo("42");
        assertThat(batch.hasMore()).isTrue();
    }

    @Test
    void fullBatchWithoutPendingMeansMoreToFetch() {
        when(response.body()).thenReturn("""
                {"results":[{"seq":1,"id":"a","doc":{"_id":"a","type":"patient"}},
                            {"seq":2,"id":"b","doc":{"_id":"b","type":"patient"}}],
                 "last_seq":2}
                """);

        assertThat(source.fetchChanges("0", 2).hasMore()).isTrue();
    }

    @Test
    void serverErrorIsAFetchFailure() {
        when(response.statusCode()).thenReturn(500);

        assertThatThrownBy(() -> source.fetchChanges("0", 10))
                .isInstanceOf(ChangeSourceException.class)
                .hasMessageContaining("500");
    }

    @Test
    void connectionFailureIsAFetchFailure() throws Exception {
        doThrow(new IOException("Connection refused")).when(httpClient).send(any(HttpRequest.class), any());

        assertThatThrownBy(() -> source.fetchChanges("0", 10))
                .isInstanceOf(ChangeSourceException.class)
                .hasCauseInstanceOf(IOException.class);
    }

    @Test
    void responseWithoutResultsIsRejected() {
        when(response.body()).thenReturn("{\"error\":\"not_found\"}");

        assertThatThrownBy(() -> source.fetchChanges("0", 10)).isInstanceOf(ChangeSourceException.class);
    }

    @Test
    void credentialsAreSentAsBasicAuth() throws Exception {
        source = new CouchDbChangeSource(httpClient, new ObjectMapper(), "http://couch:5984", "healthbridge",
                "sync", "secret", 5000);
        when(response.body()).thenReturn("{\"db_name\":\"healthbridge\",\"doc_count\":1250}");

        assertThat(source.documentCount()).hasValue(1250);

        ArgumentCaptor<HttpRequest> request = ArgumentCaptor.forClass(HttpRequest.class);
        verify(httpClient).send(request.capture(), any());
        assertThat(request.getValue().uri().toString()).isEqualTo("http://couch:5984/healthbridge");
        assertThat(request.getValue().headers().firstValue("Authorization")).hasValue("Basic c3luYzpzZWNyZXQ=");
    }
}
