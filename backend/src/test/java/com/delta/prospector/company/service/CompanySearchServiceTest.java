package com.delta.prospector.company.service;

import com.delta.prospector.company.cache.QueryCacheStore;
import com.delta.prospector.company.model.CompanyPage;
import com.delta.prospector.company.model.CompanyRecord;
import com.delta.prospector.company.model.CompanySearchResponse;
import com.delta.prospector.company.model.EngineeringPerson;
import com.delta.prospector.company.model.PeoplePage;
import com.delta.prospector.company.model.SearchFilters;
import com.delta.prospector.config.ProspectorProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.lenient;

@ExtendWith(MockitoExtension.class)
class CompanySearchServiceTest {

    @Mock
    private QueryCacheStore cacheStore;

    private FixedCompanyDataSource dataSource;
    private CompanySearchService service;

    @BeforeEach
    void setUp() {
        lenient().when(cacheStore.getOrFetch(any(), any(), any(), any()))
            .thenAnswer(invocation -> ((Supplier<?>) invocation.getArgument(3)).get());
        dataSource = new FixedCompanyDataSource(23);
        service = new CompanySearchService(cacheStore, dataSource, new ProspectorProperties());
    }

    @Test
    void firstPageOfTwentyThreeHasTenCompanies() {
        CompanySearchResponse response = service.search(filters(), 1, 10);

        assertThat(response.companies()).hasSize(10);
        assertThat(response.companies().get(0).name()).isEqualTo("Company 1");
        assertThat(response.total()).isEqualTo(23);
        assertThat(response.totalPages()).isEqualTo(3);
    }

    @Test
    void lastPageHoldsTheRemainder() {
        CompanySearchResponse response = service.search(filters(), 3, 10);

        assertThat(response.companies()).extracting(CompanyRecord::name)
            .containsExactly("Company 21", "Company 22", "Company 23");
        assertThat(response.page()).isEqualTo(3);
    }

    @Test
    void pageBeyondTotalIsEmptyWithoutUpstreamPageCall() {
        CompanySearchResponse response = service.search(filters(), 4, 10);

        assertThat(response.companies()).isEmpty();
        assertThat(response.total()).isEqualTo(23);
        assertThat(response.totalPages()).isEqualTo(3);
        assertThat(dataSource.pageRequests).isEmpty();
    }

    @Test
    void defaultsApplyWhenPageAndSizeAreMissing() {
        CompanySearchResponse response = service.search(null, null, null);

        assertThat(response.page()).isEqualTo(1);
        assertThat(response.size()).isEqualTo(10);
        assertThat(response.companies()).hasSize(10);
    }

    @Test
    void invalidPagingIsRejected() {
        assertThatThrownBy(() -> service.search(filters(), 0, 10)).isInstanceOf(InvalidSearchFiltersException.class);
        assertThatThrownBy(() -> service.search(filters(), 1, 0)).isInstanceOf(InvalidSearchFiltersException.class);
        assertThatThrownBy(() -> service.search(filters(), 1, 101))
            .isInstanceOf(InvalidSearchFiltersException.class)
            .hasMessageContaining("100");
    }

    @Test
    void invertedEmployeeBoundsAreRejected() {
        SearchFilters inverted = SearchFilters.of(500, 50, List.of());
        assertThatThrownBy(() -> service.search(inverted, 1, 10))
            .isInstanceOf(InvalidSearchFiltersException.class)
            .hasMessageContaining("min_employees");
    }

    @Test
    void employeeBoundsMustBeDigitStrings() {
        assertThat(CompanySearchService.parseEmployeeBound("min_employees", " 50 ")).isEqualTo(50);
        assertThat(CompanySearchService.parseEmployeeBound("min_employees", "")).isNull();
        assertThat(CompanySearchService.parseEmployeeBound("min_employees", null)).isNull();
        assertThatThrownBy(() -> CompanySearchService.parseEmployeeBound("max_employees", "-5"))
            .isInstanceOf(InvalidSearchFiltersException.class);
        assertThatThrownBy(() -> CompanySearchService.parseEmployeeBound("max_employees", "ten"))
            .isInstanceOf(InvalidSearchFiltersException.class);
        assertThatThrownBy(() -> CompanySearchService.parseEmployeeBound("max_employees", "99999999999"))
            .isInstanceOf(InvalidSearchFiltersException.class);
    }

    @Test
    void totalPagesRoundsUp() {
        assertThat(CompanySearchService.totalPages(0, 10)).isZero();
        assertThat(CompanySearchService.totalPages(20, 10)).isEqualTo(2);
        assertThat(CompanySearchService.totalPages(21, 10)).isEqualTo(3);
    }

    private SearchFilters filters() {
        return SearchFilters.of(50, 1000, List.of("series_a", "series_b", "series_c"));
    }

    private static final class FixedCompanyDataSource implements CompanyDataSource {
        private final List<CompanyRecord> companies = new ArrayList<>();
        private final List<Integer> pageRequests = new ArrayList<>();

        private FixedCompanyDataSource(int count) {
            for (int i = 1; i <= count; i++) {
                companies.add(new CompanyRecord("Company " + i, null, null, 100 + i, null, null, null, "series_a", null));
            }
        }

        @Override
        public CompanyPage fetchCompanyPage(SearchFilters filters, int page, int size) {
            pageRequests.add(page);
            int from = Math.min(companies.size(), (page - 1) * size);
            int to = Math.min(companies.size(), from + size);
            return new CompanyPage(companies.subList(from, to), companies.size());
        }

        @Override
        public long countCompanies(SearchFilters filters) {
            return companies.size();
        }

        @Override
        public CompanyPage lookupCompany(String companyName) {
            return new CompanyPage(List.of(), 0);
        }

        @Override
        public PeoplePage fetchEngineeringPeople(String companyDomain, List<String> titles, int size) {
            return new PeoplePage(List.<EngineeringPerson>of(), 0);
        }
    }
}
