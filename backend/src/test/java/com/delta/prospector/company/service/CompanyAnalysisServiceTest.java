package com.delta.prospector.company.service;

import com.delta.prospector.company.cache.QueryCacheStore;
import com.delta.prospector.company.model.CompanyAnalysisResponse;
import com.delta.prospector.company.model.CompanyPage;
import com.delta.prospector.company.model.CompanyRecord;
import com.delta.prospector.company.model.EngineeringPerson;
import com.delta.prospector.company.model.PeoplePage;
import com.delta.prospector.company.util.UpstreamErrorClassifier;
import com.delta.prospector.config.ProspectorProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CompanyAnalysisServiceTest {

    @Mock
    private QueryCacheStore cacheStore;
    @Mock
    private CompanyDataSource dataSource;

    private CompanyAnalysisService service;

    @BeforeEach
    void setUp() {
        lenient().when(cacheStore.getOrFetch(any(), any(), any(), any()))
            .thenAnswer(invocation -> ((Supplier<?>) invocation.getArgument(3)).get());
        ProspectorProperties properties = new ProspectorProperties();
        service = new CompanyAnalysisService(
            cacheStore,
            dataSource,
            new EngineeringTeamAnalyzer(properties),
            new OutreachMessageComposer(),
            properties
        );
    }

    @Test
    void nameOrDomainIsRequired() {
        assertThatThrownBy(() -> service.analyze(" ", null))
            .isInstanceOf(InvalidAnalysisRequestException.class)
            .hasMessage("Either company_name or company_domain is required");
        verifyNoInteractions(dataSource);
    }

    @Test
    void unknownCompanyIsNotFound() {
        when(dataSource.lookupCompany("Nope Inc")).thenReturn(new CompanyPage(List.of(), 0));

        assertThatThrownBy(() -> service.analyze("Nope Inc", null))
            .isInstanceOf(CompanyNotFoundException.class)
            .hasMessage("Could not find company data for: Nope Inc");
    }

    @Test
    void domainComesFromWebsiteAndLeadersGetMessages() {
        when(dataSource.lookupCompany("Acme")).thenReturn(new CompanyPage(List.of(acme()), 1));
        when(dataSource.fetchEngineeringPeople(eq("acme.io"), anyList(), anyInt())).thenReturn(new PeoplePage(List.of(
            new EngineeringPerson("jane doe", "VP Engineering", "canada", null),
            new EngineeringPerson("John Roe", "Software Engineer", "canada", null),
            new EngineeringPerson("Ana Lee", "Engineering Manager", "united states", null)
        ), 3));

        CompanyAnalysisResponse response = service.analyze("Acme", "ignored.example");

        assertThat(response.company().name()).isEqualTo("Acme");
        assertThat(response.engineering().hasError()).isFalse();
        assertThat(response.engineering().engineeringCount()).isEqualTo(3);
        assertThat(response.engineering().totalEmployees()).isEqualTo(120);
        assertThat(response.engineering().engineeringPercentage()).isEqualTo(2.5);
        assertThat(response.engineering().engineeringLeaders())
            .extracting(EngineeringPerson::name)
            .containsExactly("jane doe", "Ana Lee");
        assertThat(response.personalizedMessages()).hasSize(2);
        assertThat(response.personalizedMessages().get(0).message()).startsWith("Hi Jane,").contains("Acme");
        verify(dataSource).fetchEngineeringPeople(eq("acme.io"), anyList(), anyInt());
    }

    @Test
    void engineeringFailureIsReportedInBand() {
        when(dataSource.lookupCompany("Acme")).thenReturn(new CompanyPage(List.of(acme()), 1));
        when(dataSource.fetchEngineeringPeople(any(), anyList(), anyInt()))
            .thenThrow(new UpstreamException(UpstreamErrorClassifier.HTTP_429_RATE_LIMIT, "API rate limit exceeded"));

        CompanyAnalysisResponse response = service.analyze("Acme", null);

        assertThat(response.company().name()).isEqualTo("Acme");
        assertThat(response.engineering().error()).isEqualTo(CompanyAnalysisService.NO_ENGINEERING_DATA);
        assertThat(response.personalizedMessages()).isEmpty();
    }

    @Test
    void companyWithoutWebsiteReportsMissingDomain() {
        CompanyRecord noWebsite = new CompanyRecord("Quiet Co", null, null, 80, null, null, null, null, null);
        when(dataSource.lookupCompany("Quiet Co")).thenReturn(new CompanyPage(List.of(noWebsite), 1));

        CompanyAnalysisResponse response = service.analyze("Quiet Co", null);

        assertThat(response.engineering().error()).isEqualTo(CompanyAnalysisService.NO_DOMAIN);
        assertThat(response.personalizedMessages()).isEmpty();
    }

    @Test
    void domainOnlyRequestSkipsCompanyLookup() {
        when(dataSource.fetchEngineeringPeople(eq("beta.dev"), anyList(), anyInt()))
            .thenReturn(new PeoplePage(List.of(), 0));

        CompanyAnalysisResponse response = service.analyze(null, "https://Beta.dev/careers");

        assertThat(response.company()).isNull();
        assertThat(response.engineering().engineeringCount()).isZero();
        assertThat(response.engineering().engineeringPercentage()).isZero();
    }

    @Test
    void domainNormalizationDropsSchemePathAndPort() {
        assertThat(CompanyAnalysisService.normalizeDomain("https://www.acme.io/about?x=1")).isEqualTo("www.acme.io");
        assertThat(CompanyAnalysisService.normalizeDomain("acme.io:8443")).isEqualTo("acme.io");
        assertThat(CompanyAnalysisService.normalizeDomain("  ")).isNull();
    }

    private CompanyRecord acme() {
        return new CompanyRecord("Acme", "https://acme.io/", "linkedin.com/company/acme", 120,
            "Toronto, Ontario, Canada", "computer software", 2016, "series_b", 3.0e7);
    }
}
